package my.finresolver.app.resolve;

import my.finresolver.app.config.AppProperties;
import my.finresolver.app.domain.DataAxis;
import my.finresolver.app.domain.HeadFamily;
import my.finresolver.app.domain.MetricHead;
import my.finresolver.app.domain.MetricKind;
import my.finresolver.app.domain.ResolvedQuerySpec;
import my.finresolver.app.lexicon.DissectionMatch;
import my.finresolver.app.lexicon.FinancialLexicon;
import my.finresolver.app.metadata.MetadataSnapshot;
import my.finresolver.app.query.DataTable;
import my.finresolver.app.query.QueryBuilder;
import my.finresolver.app.query.QueryExecutor;
import my.finresolver.app.util.TextNormalizer;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Finds a metric head for a phrase that has data for the requested company, period and consolidation.
 * Runs the {@link CascadeStep}s in order; inside a step, kinds are tried in {@link KindPreference} order
 * and every name-matched head is confirmed with a count query before it is accepted.
 */
@Service
public class MetricHeadValidator {
	private static final Logger logger = LoggerFactory.getLogger(MetricHeadValidator.class);

	private final FinancialLexicon lexicon;
	private final QueryBuilder queryBuilder;
	private final QueryExecutor queryExecutor;
	private final JaroWinklerSimilarity similarity = new JaroWinklerSimilarity();
	private final int maxSuggestions;

	public MetricHeadValidator(FinancialLexicon lexicon,
							   QueryBuilder queryBuilder,
							   QueryExecutor queryExecutor,
							   AppProperties properties) {
		this.lexicon = lexicon;
		this.queryBuilder = queryBuilder;
		this.queryExecutor = queryExecutor;
		this.maxSuggestions = properties.resolver().maxSuggestions();
	}

	public MetricValidation validate(MetricValidationRequest request, MetadataSnapshot snapshot, Deadline deadline) {
		String phrase = TextNormalizer.normalize(request.metricPhrase());
		List<String> names = lexicon.expandMetricNames(phrase);
		List<String> baseNames = List.of();
		if (request.dissection() != null) {
			String base = TextNormalizer.removePhrase(phrase, request.dissection().indicator());
			baseNames = lexicon.expandMetricNames(base);
		}
		List<MetricKind.Type> kinds = KindPreference.order(request.ratioIndicator(), !baseNames.isEmpty());

		Set<HeadCandidate> checked = new HashSet<>();
		List<HeadCandidate> empty = new ArrayList<>();
		int checks = 0;
		for (CascadeStep step : CascadeStep.values()) {
			Set<Long> industries = null;
			if (step.industryFiltered()) {
				try {
					industries = requireIndustries(request.company());
				} catch (IndustryValidationFailedException ex) {
					logger.debug("Skipping {}: {}", step, ex.getMessage());
					continue;
				}
			}
			for (MetricKind.Type kind : kinds) {
				List<HeadCandidate> candidates = candidates(kind, step, names, baseNames, industries, request, snapshot);
				for (HeadCandidate candidate : candidates) {
					if (!checked.add(candidate)) {
						continue;
					}
					if (deadline.isExpired()) {
						logger.warn("Metric validation for '{}' timed out after {} checks.", request.metricPhrase(), checks);
						return MetricValidation.timedOut(empty, candidate, checks);
					}
					long count = queryExecutor.count(queryBuilder.existence(spec(candidate, request)));
					checks++;
					if (count > 0) {
						logger.info("Metric '{}' resolved to {} at {} ({} rows).",
								request.metricPhrase(), candidate.describe(), step, count);
						return MetricValidation.accepted(candidate, count, empty, checks);
					}
					logger.debug("Candidate {} has no data at {}.", candidate.describe(), step);
					empty.add(candidate);
				}
			}
		}
		if (!empty.isEmpty()) {
			logger.warn("Metric '{}' matched {} heads but none has data.", request.metricPhrase(), empty.size());
			return MetricValidation.noData(empty, checks);
		}
		logger.warn("Metric '{}' matched no head.", request.metricPhrase());
		return MetricValidation.notFound(nearestNames(phrase, snapshot));
	}

	private Set<Long> requireIndustries(CompanyContext company) {
		if (company == null || !company.hasIndustryContext()) {
			String name = company == null ? "unknown company" : company.company().name();
			throw new IndustryValidationFailedException("No industry context for " + name);
		}
		return company.industryIds();
	}

	private List<HeadCandidate> candidates(MetricKind.Type type,
										   CascadeStep step,
										   List<String> names,
										   List<String> baseNames,
										   Set<Long> industries,
										   MetricValidationRequest request,
										   MetadataSnapshot snapshot) {
		switch (type) {
			case REGULAR -> {
				MetricKind kind = MetricKind.regular();
				DataAxis axis = DataTable.axisFor(kind, request.period().basis(), null);
				return toCandidates(match(snapshot.heads(HeadFamily.REGULAR), names, step, industries), kind, axis);
			}
			case RATIO -> {
				MetricKind kind = MetricKind.ratio();
				return toCandidates(match(snapshot.heads(HeadFamily.RATIO), names, step, industries), kind, DataAxis.RATIO);
			}
			default -> {
				DissectionMatch dissection = request.dissection();
				MetricKind kind = MetricKind.dissection(dissection.groupId());
				DataAxis axis = DataTable.axisFor(kind, request.period().basis(), dissection.group().dataAxis());
				// dissection rows are keyed on the regular head master, whatever the group's axis
				return toCandidates(match(snapshot.heads(HeadFamily.REGULAR), baseNames, step, industries), kind, axis);
			}
		}
	}

	/**
	 * Heads whose name equals (exact step) or contains as whole words (contains step) one of the names,
	 * ordered by which name matched, then shorter name, then id.
	 */
	private List<MetricHead> match(List<MetricHead> heads, List<String> names, CascadeStep step, Set<Long> industries) {
		if (names.isEmpty()) {
			return List.of();
		}
		List<ScoredHead> matched = new ArrayList<>();
		for (MetricHead head : heads) {
			if (industries != null && !industries.contains(head.industryId())) {
				continue;
			}
			String headName = TextNormalizer.normalize(head.name());
			for (int i = 0; i < names.size(); i++) {
				String name = names.get(i);
				boolean hit = step.exact() ? headName.equals(name) : TextNormalizer.containsPhrase(headName, name);
				if (hit) {
					matched.add(new ScoredHead(head, i, headName.length()));
					break;
				}
			}
		}
		matched.sort(Comparator.comparingInt(ScoredHead::nameRank)
				.thenComparingInt(ScoredHead::nameLength)
				.thenComparingLong(scored -> scored.head().headId()));
		return matched.stream().map(ScoredHead::head).toList();
	}

	private static List<HeadCandidate> toCandidates(List<MetricHead> heads, MetricKind kind, DataAxis axis) {
		return heads.stream().map(head -> new HeadCandidate(head, kind, axis)).toList();
	}

	private static ResolvedQuerySpec spec(HeadCandidate candidate, MetricValidationRequest request) {
		return new ResolvedQuerySpec(
				request.company().companyId(),
				candidate.head(),
				candidate.kind(),
				request.period(),
				request.consolidationId(),
				candidate.axis()
		);
	}

	private List<String> nearestNames(String phrase, MetadataSnapshot snapshot) {
		Map<String, Double> scores = snapshot.headNames().stream()
				.collect(Collectors.toMap(Function.identity(),
						name -> similarity.apply(phrase, TextNormalizer.normalize(name)),
						Math::max));
		return scores.entrySet().stream()
				.sorted(Map.Entry.<String, Double>comparingByValue().reversed()
						.thenComparing(Map.Entry.<String, Double>comparingByKey()))
				.limit(maxSuggestions)
				.map(Map.Entry::getKey)
				.toList();
	}

	private record ScoredHead(MetricHead head, int nameRank, int nameLength) {
	}
}
