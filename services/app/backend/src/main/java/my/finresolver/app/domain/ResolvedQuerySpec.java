package my.finresolver.app.domain;

/**
 * Validated identifier tuple handed to the query builder.
 */
public record ResolvedQuerySpec(
		long companyId,
		MetricHead head,
		MetricKind kind,
		ResolvedPeriod period,
		long consolidationId,
		DataAxis axis
) {
	public Long dissectionGroupId() {
		return kind.isDissection() ? kind.dissectionGroupId() : null;
	}
}
