package my.finresolver.app.lexicon;

import my.finresolver.app.util.TextNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Keyword lexicon for metric aliases, ratio and dissection indicators, consolidation synonyms and the
 * filler words stripped from metric phrases. All entries are normalized on construction and all
 * lookups expect normalized text.
 */
public record FinancialLexicon(
		List<MetricAlias> metricAliases,
		List<String> ratioIndicators,
		List<DissectionGroupDefinition> dissectionGroups,
		ConsolidationSynonyms consolidation,
		List<String> stopWords
) {
	public FinancialLexicon {
		metricAliases = metricAliases == null ? List.of() : List.copyOf(metricAliases);
		ratioIndicators = ratioIndicators == null
				? List.of()
				: ratioIndicators.stream().map(TextNormalizer::normalize).toList();
		dissectionGroups = dissectionGroups == null ? List.of() : List.copyOf(dissectionGroups);
		consolidation = consolidation == null ? new ConsolidationSynonyms(null, null, null, null) : consolidation;
		stopWords = stopWords == null ? List.of() : stopWords.stream().map(TextNormalizer::normalize).toList();
	}

	/**
	 * The phrase itself followed by every name the alias table equates with it.
	 */
	public List<String> expandMetricNames(String normalizedPhrase) {
		Set<String> names = new LinkedHashSet<>();
		if (normalizedPhrase == null || normalizedPhrase.isBlank()) {
			return List.of();
		}
		names.add(normalizedPhrase);
		for (MetricAlias alias : metricAliases) {
			if (alias.matches(normalizedPhrase)) {
				names.add(alias.canonical());
				names.addAll(alias.aliases());
			}
		}
		return new ArrayList<>(names);
	}

	public Optional<String> longestMetricTerm(String normalizedText) {
		String best = null;
		for (MetricAlias alias : metricAliases) {
			best = longer(best, normalizedText, alias.canonical());
			for (String value : alias.aliases()) {
				best = longer(best, normalizedText, value);
			}
		}
		return Optional.ofNullable(best);
	}

	public boolean isMetricTerm(String normalizedText) {
		for (MetricAlias alias : metricAliases) {
			if (alias.matches(normalizedText)) {
				return true;
			}
		}
		return false;
	}

	public boolean hasRatioIndicator(String normalizedText) {
		for (String indicator : ratioIndicators) {
			if (TextNormalizer.containsPhrase(normalizedText, indicator)) {
				return true;
			}
		}
		return false;
	}

	public Optional<DissectionMatch> detectDissection(String normalizedText) {
		DissectionMatch best = null;
		for (DissectionGroupDefinition group : dissectionGroups) {
			for (String indicator : group.indicators()) {
				if (!TextNormalizer.containsPhrase(normalizedText, indicator)) {
					continue;
				}
				if (best == null || indicator.length() > best.indicator().length()) {
					best = new DissectionMatch(group, indicator);
				}
			}
		}
		return Optional.ofNullable(best);
	}

	public Optional<LexiconMatch> detectConsolidation(String normalizedText) {
		// unconsolidated first, it contains the consolidated keyword
		for (String synonym : consolidation.unconsolidated()) {
			if (TextNormalizer.containsPhrase(normalizedText, synonym)) {
				return Optional.of(new LexiconMatch(synonym, consolidation.unconsolidatedLabel()));
			}
		}
		for (String synonym : consolidation.consolidated()) {
			if (TextNormalizer.containsPhrase(normalizedText, synonym)) {
				return Optional.of(new LexiconMatch(synonym, consolidation.consolidatedLabel()));
			}
		}
		return Optional.empty();
	}

	public boolean isStopWord(String token) {
		return stopWords.contains(token);
	}

	private static String longer(String current, String text, String candidate) {
		if (candidate.isEmpty() || !TextNormalizer.containsPhrase(text, candidate)) {
			return current;
		}
		if (current == null || candidate.length() > current.length()) {
			return candidate;
		}
		return current;
	}
}
