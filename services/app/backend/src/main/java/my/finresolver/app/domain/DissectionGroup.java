package my.finresolver.app.domain;

public record DissectionGroup(long groupId, String label) {
}
