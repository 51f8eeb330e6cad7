package my.finresolver.app.domain;

public record Sector(long sectorId, String name) {
}
