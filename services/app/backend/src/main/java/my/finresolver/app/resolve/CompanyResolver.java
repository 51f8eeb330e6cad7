package my.finresolver.app.resolve;

import my.finresolver.app.config.AppProperties;
import my.finresolver.app.domain.Company;
import my.finresolver.app.domain.Sector;
import my.finresolver.app.metadata.MetadataSnapshot;
import my.finresolver.app.util.TextNormalizer;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a company phrase to a company. Exact ticker wins, then exact name, then Jaro-Winkler similarity
 * against names and tickers. Pure function of the snapshot.
 */
@Service
public class CompanyResolver {
	private static final Logger logger = LoggerFactory.getLogger(CompanyResolver.class);
	private static final double CONTAINED_NAME_SCORE = 0.9;

	private final JaroWinklerSimilarity similarity = new JaroWinklerSimilarity();
	private final double threshold;
	private final int maxSuggestions;

	public CompanyResolver(AppProperties properties) {
		this.threshold = properties.resolver().companyMatchThreshold();
		this.maxSuggestions = properties.resolver().maxSuggestions();
	}

	public CompanyMatch resolve(String phrase, MetadataSnapshot snapshot) {
		String trimmed = TextNormalizer.trimToNull(phrase);
		if (trimmed == null) {
			return CompanyMatch.notFound(List.of());
		}
		Optional<Company> byTicker = snapshot.companyByTicker(trimmed);
		if (byTicker.isPresent()) {
			logger.info("Company '{}' matched ticker {}.", phrase, byTicker.get().ticker());
			return CompanyMatch.resolved(context(byTicker.get(), snapshot));
		}
		String normalized = TextNormalizer.normalize(trimmed);
		for (Company company : snapshot.companies()) {
			if (TextNormalizer.normalize(company.name()).equals(normalized)) {
				logger.info("Company '{}' matched name {}.", phrase, company.name());
				return CompanyMatch.resolved(context(company, snapshot));
			}
		}

		List<CompanyCandidate> scored = new ArrayList<>();
		for (Company company : snapshot.companies()) {
			scored.add(new CompanyCandidate(company, score(normalized, company)));
		}
		scored.sort(Comparator.comparingDouble(CompanyCandidate::score).reversed()
				.thenComparing(candidate -> candidate.company().name()));
		List<CompanyCandidate> accepted = scored.stream()
				.filter(candidate -> candidate.score() >= threshold)
				.toList();
		if (accepted.size() == 1) {
			Company company = accepted.get(0).company();
			logger.info("Company '{}' matched {} (similarity {}).", phrase, company.name(), accepted.get(0).score());
			return CompanyMatch.resolved(context(company, snapshot));
		}
		if (accepted.size() > 1) {
			logger.info("Company '{}' is ambiguous between {} candidates.", phrase, accepted.size());
			return CompanyMatch.ambiguous(accepted.subList(0, Math.min(maxSuggestions, accepted.size())));
		}
		logger.warn("Company '{}' not found.", phrase);
		return CompanyMatch.notFound(scored.subList(0, Math.min(maxSuggestions, scored.size())));
	}

	double score(String normalizedPhrase, Company company) {
		String name = TextNormalizer.normalize(company.name());
		double best = similarity.apply(normalizedPhrase, name);
		if (company.ticker() != null && !company.ticker().isBlank()) {
			best = Math.max(best, similarity.apply(normalizedPhrase, TextNormalizer.normalize(company.ticker())));
		}
		if (TextNormalizer.containsPhrase(name, normalizedPhrase)) {
			best = Math.max(best, CONTAINED_NAME_SCORE);
		}
		return best;
	}

	/**
	 * Explicit company industry wins; otherwise every industry mapped to the company's sector.
	 */
	public CompanyContext context(Company company, MetadataSnapshot snapshot) {
		Sector sector = snapshot.sector(company.sectorId()).orElse(null);
		Set<Long> industries = company.industryId() != null
				? Set.of(company.industryId())
				: snapshot.industriesForSector(company.sectorId());
		return new CompanyContext(company, sector, industries);
	}
}
