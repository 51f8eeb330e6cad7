package my.finresolver.app.query;

import java.util.Map;

public record RenderedQuery(String sql, Map<String, Object> parameters) {
}
