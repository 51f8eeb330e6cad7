package my.finresolver.app.domain;

public record IndustrySectorMapping(long industryId, long sectorId) {
}
