package my.finresolver.app.resolve;

import my.finresolver.app.config.AppProperties;
import my.finresolver.app.domain.Company;
import my.finresolver.app.domain.HeadFamily;
import my.finresolver.app.domain.MetricHead;
import my.finresolver.app.lexicon.DissectionMatch;
import my.finresolver.app.lexicon.FinancialLexicon;
import my.finresolver.app.lexicon.LexiconMatch;
import my.finresolver.app.metadata.MetadataSnapshot;
import my.finresolver.app.util.TextNormalizer;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a raw query into company, metric, period and consolidation fragments. Period and consolidation
 * are taken out first, then the company, and whatever is left is the metric phrase.
 */
@Component
public class EntityExtractor {
	private static final Logger logger = LoggerFactory.getLogger(EntityExtractor.class);
	private static final Pattern COMPANY_AFTER_PREPOSITION = Pattern.compile(
			"\\b(?:for|of)\\s+([a-z0-9&][a-z0-9&% ]*?)(?=\\s+(?:for|in|during|at|on|as|with)\\b|$)");
	private static final Pattern POSSESSIVE_COMPANY = Pattern.compile(
			"((?:[\\p{L}0-9&.]+\\s+){0,3}[\\p{L}0-9&.]+)['\u2019]s\\b");
	private static final double EXPLICIT_PERIOD = 0.95;
	private static final double BARE_YEAR_PERIOD = 0.7;
	private static final double CONSOLIDATION_KEYWORD = 1.0;
	private static final double DEFAULT_CONSOLIDATION = 0.5;
	private static final double COMPANY_NAME = 1.0;
	private static final double COMPANY_TICKER = 0.95;
	private static final double PHRASE_COMPANY_CONFIDENCE = 0.6;
	private static final double FUZZY_COMPANY_FACTOR = 0.7;
	private static final double KNOWN_METRIC = 0.9;
	private static final double RESIDUAL_METRIC = 0.4;
	private static final int MAX_COMPANY_WORDS = 4;

	private final FinancialLexicon lexicon;
	private final JaroWinklerSimilarity similarity = new JaroWinklerSimilarity();
	private final double minConfidence;
	private final double companyThreshold;
	private final String defaultConsolidation;

	public EntityExtractor(FinancialLexicon lexicon, AppProperties properties) {
		this.lexicon = lexicon;
		this.minConfidence = properties.resolver().minFragmentConfidence();
		this.companyThreshold = properties.resolver().companyMatchThreshold();
		this.defaultConsolidation = properties.resolver().defaultConsolidation();
	}

	public ExtractedEntities extract(String rawQuery, MetadataSnapshot snapshot) {
		String text = TextNormalizer.collapseWhitespace(rawQuery);

		Optional<PeriodMatch> periodMatch = PeriodMatch.find(text);
		ExtractedFragment period = periodMatch
				.map(match -> fragment(match.text(),
						match.form() == PeriodForm.BARE_YEAR ? BARE_YEAR_PERIOD : EXPLICIT_PERIOD))
				.orElse(ExtractedFragment.absent());
		String remainder = periodMatch
				.map(match -> text.substring(0, match.start()) + " " + text.substring(match.end()))
				.orElse(text);
		String normalized = TextNormalizer.normalize(remainder);

		ExtractedFragment consolidation;
		Optional<LexiconMatch> consolidationMatch = lexicon.detectConsolidation(normalized);
		if (consolidationMatch.isPresent()) {
			consolidation = fragment(consolidationMatch.get().label(), CONSOLIDATION_KEYWORD);
			normalized = TextNormalizer.removePhrase(normalized, consolidationMatch.get().keyword());
		} else {
			consolidation = fragment(defaultConsolidation, DEFAULT_CONSOLIDATION);
		}

		ExtractedFragment company = ExtractedFragment.absent();
		CompanyHit hit = findCompany(normalized, remainder, snapshot);
		if (hit != null) {
			company = fragment(hit.value(), hit.confidence());
			normalized = TextNormalizer.removePhrase(normalized, hit.span());
		}

		String metricText = trimStopWords(normalized);
		ExtractedFragment metric = metricText.isEmpty()
				? ExtractedFragment.absent()
				: fragment(metricText, isKnownMetric(metricText, snapshot) ? KNOWN_METRIC : RESIDUAL_METRIC);
		boolean ratio = metric.isPresent() && lexicon.hasRatioIndicator(metricText);
		DissectionMatch dissection = metric.isPresent() ? lexicon.detectDissection(metricText).orElse(null) : null;
		boolean relative = periodMatch.map(match -> match.form() == PeriodForm.RELATIVE).orElse(false);

		ExtractedEntities entities = new ExtractedEntities(rawQuery, company, metric, period, consolidation,
				relative, ratio, dissection);
		logger.debug("Extracted company='{}' metric='{}' period='{}' consolidation='{}' from '{}'.",
				company.text(), metric.text(), period.text(), consolidation.text(), rawQuery);
		return entities;
	}

	private ExtractedFragment fragment(String text, double confidence) {
		return ExtractedFragment.of(text, confidence, minConfidence);
	}

	private CompanyHit findCompany(String text, String rawText, MetadataSnapshot snapshot) {
		CompanyHit best = null;
		for (Company company : snapshot.companies()) {
			String name = TextNormalizer.normalize(company.name());
			if (name.isEmpty() || !TextNormalizer.containsPhrase(text, name)) {
				continue;
			}
			if (best == null || name.length() > best.span().length()) {
				best = new CompanyHit(name, company.name(), COMPANY_NAME);
			}
		}
		if (best != null) {
			return best;
		}
		for (String token : text.split(" ")) {
			if (token.length() < 2 || lexicon.isStopWord(token) || lexicon.isMetricTerm(token)) {
				continue;
			}
			Optional<Company> company = snapshot.companyByTicker(token);
			if (company.isPresent()) {
				return new CompanyHit(token, company.get().ticker(), COMPANY_TICKER);
			}
		}
		CompanyHit possessive = possessiveCompany(text, rawText);
		if (possessive != null) {
			return possessive;
		}
		CompanyHit afterPreposition = companyAfterPreposition(text);
		if (afterPreposition != null) {
			return afterPreposition;
		}
		return fuzzyCompany(text, snapshot);
	}

	/**
	 * "Lucky Cement's revenue": up to four words before a possessive, minus leading filler words.
	 */
	private CompanyHit possessiveCompany(String text, String rawText) {
		Matcher matcher = POSSESSIVE_COMPANY.matcher(rawText);
		while (matcher.find()) {
			String candidate = trimLeadingStopWords(TextNormalizer.normalize(matcher.group(1)));
			if (!candidate.isEmpty() && !lexicon.isMetricTerm(candidate) && TextNormalizer.containsPhrase(text, candidate)) {
				return new CompanyHit(candidate, candidate, PHRASE_COMPANY_CONFIDENCE);
			}
		}
		return null;
	}

	private CompanyHit companyAfterPreposition(String text) {
		String masked = text;
		Optional<DissectionMatch> dissection = lexicon.detectDissection(text);
		if (dissection.isPresent()) {
			masked = TextNormalizer.removePhrase(text, dissection.get().indicator());
		}
		CompanyHit last = null;
		Matcher matcher = COMPANY_AFTER_PREPOSITION.matcher(masked);
		while (matcher.find()) {
			String candidate = trimStopWords(matcher.group(1));
			if (!candidate.isEmpty() && !lexicon.isMetricTerm(candidate)) {
				last = new CompanyHit(candidate, candidate, PHRASE_COMPANY_CONFIDENCE);
			}
		}
		return last;
	}

	private CompanyHit fuzzyCompany(String text, MetadataSnapshot snapshot) {
		String[] tokens = text.split(" ");
		String bestWindow = null;
		double bestScore = 0.0;
		for (int size = 1; size <= MAX_COMPANY_WORDS; size++) {
			for (int start = 0; start + size <= tokens.length; start++) {
				if (lexicon.isStopWord(tokens[start]) || lexicon.isStopWord(tokens[start + size - 1])) {
					continue;
				}
				String window = String.join(" ", Arrays.copyOfRange(tokens, start, start + size));
				if (lexicon.isMetricTerm(window)) {
					continue;
				}
				for (Company company : snapshot.companies()) {
					double score = similarity.apply(window, TextNormalizer.normalize(company.name()));
					if (score > bestScore) {
						bestScore = score;
						bestWindow = window;
					}
				}
			}
		}
		if (bestWindow == null || bestScore < companyThreshold) {
			return null;
		}
		return new CompanyHit(bestWindow, bestWindow, bestScore * FUZZY_COMPANY_FACTOR);
	}

	private boolean isKnownMetric(String metricText, MetadataSnapshot snapshot) {
		if (lexicon.longestMetricTerm(metricText).isPresent()) {
			return true;
		}
		for (HeadFamily family : HeadFamily.values()) {
			for (MetricHead head : snapshot.heads(family)) {
				String name = TextNormalizer.normalize(head.name());
				if (!name.isEmpty() && TextNormalizer.containsPhrase(metricText, name)) {
					return true;
				}
			}
		}
		return false;
	}

	private String trimLeadingStopWords(String text) {
		List<String> tokens = new ArrayList<>(Arrays.asList(text.split(" ")));
		while (!tokens.isEmpty() && (tokens.get(0).isEmpty() || lexicon.isStopWord(tokens.get(0)))) {
			tokens.remove(0);
		}
		return String.join(" ", tokens);
	}

	private String trimStopWords(String text) {
		List<String> tokens = new ArrayList<>(Arrays.asList(TextNormalizer.collapseWhitespace(text).split(" ")));
		tokens.removeIf(String::isEmpty);
		while (!tokens.isEmpty() && lexicon.isStopWord(tokens.get(0))) {
			tokens.remove(0);
		}
		while (!tokens.isEmpty() && lexicon.isStopWord(tokens.get(tokens.size() - 1))) {
			tokens.remove(tokens.size() - 1);
		}
		return String.join(" ", tokens);
	}

	private record CompanyHit(String span, String value, double confidence) {
	}
}
