package my.finresolver.app.lexicon;

import my.finresolver.app.util.TextNormalizer;

import java.util.List;

public record MetricAlias(String canonical, List<String> aliases) {
	public MetricAlias {
		canonical = TextNormalizer.normalize(canonical);
		aliases = aliases == null ? List.of() : aliases.stream().map(TextNormalizer::normalize).toList();
	}

	public boolean matches(String normalizedPhrase) {
		return canonical.equals(normalizedPhrase) || aliases.contains(normalizedPhrase);
	}
}
