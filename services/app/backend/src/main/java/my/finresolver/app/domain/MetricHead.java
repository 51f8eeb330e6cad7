package my.finresolver.app.domain;

public record MetricHead(
		long headId,
		String name,
		long industryId,
		Long unitId,
		HeadFamily family
) {
}
