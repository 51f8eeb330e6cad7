package my.finresolver.app.query;

public record Ordering(Column column, boolean descending) {
}
