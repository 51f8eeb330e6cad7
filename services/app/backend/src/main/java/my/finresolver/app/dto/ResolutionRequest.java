package my.finresolver.app.dto;

/**
 * Already separated query fragments. A null consolidation phrase means the configured default.
 */
public record ResolutionRequest(
		String companyPhrase,
		String metricPhrase,
		String periodPhrase,
		String consolidationPhrase
) {
}
