package my.finresolver.app.domain;

public record Unit(long unitId, String label) {
}
