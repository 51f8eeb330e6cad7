package my.finresolver.app.resolve;

import my.finresolver.app.domain.ResolvedPeriod;
import my.finresolver.app.lexicon.DissectionMatch;

public record MetricValidationRequest(
		String metricPhrase,
		CompanyContext company,
		ResolvedPeriod period,
		long consolidationId,
		boolean ratioIndicator,
		DissectionMatch dissection
) {
}
