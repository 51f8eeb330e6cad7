package my.finresolver.app.domain;

public record Industry(long industryId, String name) {
}
