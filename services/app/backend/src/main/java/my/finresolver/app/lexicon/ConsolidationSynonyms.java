package my.finresolver.app.lexicon;

import my.finresolver.app.util.TextNormalizer;

import java.util.List;

public record ConsolidationSynonyms(
		String consolidatedLabel,
		List<String> consolidated,
		String unconsolidatedLabel,
		List<String> unconsolidated
) {
	public ConsolidationSynonyms {
		consolidatedLabel = consolidatedLabel == null ? "Consolidated" : consolidatedLabel;
		unconsolidatedLabel = unconsolidatedLabel == null ? "Unconsolidated" : unconsolidatedLabel;
		consolidated = consolidated == null ? List.of() : consolidated.stream().map(TextNormalizer::normalize).toList();
		unconsolidated = unconsolidated == null ? List.of() : unconsolidated.stream().map(TextNormalizer::normalize).toList();
	}
}
