package my.finresolver.app.dto;

/**
 * Display values for the answer formatter.
 */
public record AnswerContext(
		String companyName,
		String ticker,
		String metricName,
		String metricKind,
		String unit,
		String periodLabel,
		String consolidationLabel
) {
}
