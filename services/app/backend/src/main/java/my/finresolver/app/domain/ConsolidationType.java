package my.finresolver.app.domain;

public record ConsolidationType(long consolidationId, String label) {
}
