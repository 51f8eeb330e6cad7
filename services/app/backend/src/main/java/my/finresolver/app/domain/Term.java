package my.finresolver.app.domain;

public record Term(long termId, String label) {
}
