package my.finresolver.app.service;

import my.finresolver.app.config.AppProperties;
import my.finresolver.app.domain.ConsolidationType;
import my.finresolver.app.domain.DissectionGroup;
import my.finresolver.app.domain.ResolvedPeriod;
import my.finresolver.app.domain.ResolvedQuerySpec;
import my.finresolver.app.domain.Unit;
import my.finresolver.app.dto.AnswerContext;
import my.finresolver.app.dto.FailureType;
import my.finresolver.app.dto.ResolutionRequest;
import my.finresolver.app.dto.ResolutionResult;
import my.finresolver.app.lexicon.DissectionMatch;
import my.finresolver.app.lexicon.FinancialLexicon;
import my.finresolver.app.lexicon.LexiconMatch;
import my.finresolver.app.metadata.MetadataCache;
import my.finresolver.app.metadata.MetadataSnapshot;
import my.finresolver.app.query.QueryBuilder;
import my.finresolver.app.query.QueryExecutor;
import my.finresolver.app.query.QuerySpec;
import my.finresolver.app.resolve.CompanyContext;
import my.finresolver.app.resolve.CompanyMatch;
import my.finresolver.app.resolve.CompanyResolver;
import my.finresolver.app.resolve.Deadline;
import my.finresolver.app.resolve.EntityExtractor;
import my.finresolver.app.resolve.ExtractedEntities;
import my.finresolver.app.resolve.HeadCandidate;
import my.finresolver.app.resolve.MetricHeadValidator;
import my.finresolver.app.resolve.MetricValidation;
import my.finresolver.app.resolve.MetricValidationRequest;
import my.finresolver.app.resolve.PeriodResolver;
import my.finresolver.app.resolve.PeriodUnresolvableException;
import my.finresolver.app.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one resolution: extract, company, consolidation, period, metric head, query. Recoverable problems
 * come back as failed results; metadata and query execution errors propagate.
 */
@Service
public class FinancialQueryResolver {
	private static final Logger logger = LoggerFactory.getLogger(FinancialQueryResolver.class);

	private final MetadataCache metadataCache;
	private final EntityExtractor entityExtractor;
	private final CompanyResolver companyResolver;
	private final PeriodResolver periodResolver;
	private final MetricHeadValidator metricHeadValidator;
	private final QueryBuilder queryBuilder;
	private final QueryExecutor queryExecutor;
	private final FinancialLexicon lexicon;
	private final Clock clock;
	private final Duration requestTimeout;
	private final String defaultConsolidation;

	public FinancialQueryResolver(MetadataCache metadataCache,
								  EntityExtractor entityExtractor,
								  CompanyResolver companyResolver,
								  PeriodResolver periodResolver,
								  MetricHeadValidator metricHeadValidator,
								  QueryBuilder queryBuilder,
								  QueryExecutor queryExecutor,
								  FinancialLexicon lexicon,
								  Clock clock,
								  AppProperties properties) {
		this.metadataCache = metadataCache;
		this.entityExtractor = entityExtractor;
		this.companyResolver = companyResolver;
		this.periodResolver = periodResolver;
		this.metricHeadValidator = metricHeadValidator;
		this.queryBuilder = queryBuilder;
		this.queryExecutor = queryExecutor;
		this.lexicon = lexicon;
		this.clock = clock;
		this.requestTimeout = properties.resolver().requestTimeout();
		this.defaultConsolidation = properties.resolver().defaultConsolidation();
	}

	public ExtractedEntities extract(String rawQuery) {
		return entityExtractor.extract(rawQuery, metadataCache.current());
	}

	public ResolutionResult resolve(String rawQuery) {
		MetadataSnapshot snapshot = metadataCache.current();
		Deadline deadline = Deadline.after(clock, requestTimeout);
		ExtractedEntities entities = entityExtractor.extract(rawQuery, snapshot);
		List<String> lowConfidence = entities.lowConfidenceFragments();
		if (!lowConfidence.isEmpty()) {
			logger.warn("Low-confidence fragments {} in query '{}'.", lowConfidence, rawQuery);
		}
		ResolutionRequest request = new ResolutionRequest(
				entities.company().text(),
				entities.metric().text(),
				entities.period().text(),
				entities.consolidation().text()
		);
		return resolve(request, snapshot, deadline).withLowConfidence(lowConfidence);
	}

	public ResolutionResult resolve(ResolutionRequest request) {
		return resolve(request, metadataCache.current(), Deadline.after(clock, requestTimeout));
	}

	private ResolutionResult resolve(ResolutionRequest request, MetadataSnapshot snapshot, Deadline deadline) {
		List<String> missing = new ArrayList<>();
		if (TextNormalizer.trimToNull(request.companyPhrase()) == null) {
			missing.add("company");
		}
		if (TextNormalizer.trimToNull(request.metricPhrase()) == null) {
			missing.add("metric");
		}
		if (TextNormalizer.trimToNull(request.periodPhrase()) == null) {
			missing.add("period");
		}
		if (!missing.isEmpty()) {
			return ResolutionResult.failed(FailureType.MISSING_FRAGMENT,
					"The query does not name a " + String.join(", ", missing), missing);
		}

		CompanyMatch companyMatch = companyResolver.resolve(request.companyPhrase(), snapshot);
		if (companyMatch.status() == CompanyMatch.Status.AMBIGUOUS) {
			return ResolutionResult.failed(FailureType.AMBIGUOUS_COMPANY,
					"'" + request.companyPhrase() + "' matches several companies", companyMatch.candidateNames());
		}
		if (companyMatch.status() == CompanyMatch.Status.NOT_FOUND) {
			return ResolutionResult.failed(FailureType.COMPANY_NOT_FOUND,
					"No company matches '" + request.companyPhrase() + "'", companyMatch.candidateNames());
		}
		CompanyContext company = companyMatch.context();

		Optional<ConsolidationType> consolidation = consolidation(request.consolidationPhrase(), snapshot);
		if (consolidation.isEmpty()) {
			return ResolutionResult.failed(FailureType.MISSING_FRAGMENT,
					"Unknown consolidation type '" + request.consolidationPhrase() + "'", List.of("consolidation"));
		}
		if (deadline.isExpired()) {
			return timedOut(List.of(company.company().name()));
		}

		String metricText = TextNormalizer.normalize(request.metricPhrase());
		boolean ratioIndicator = lexicon.hasRatioIndicator(metricText);
		DissectionMatch dissection = lexicon.detectDissection(metricText).orElse(null);

		ResolvedPeriod period;
		try {
			period = periodResolver.resolve(request.periodPhrase(), company,
					consolidation.get().consolidationId(), ratioIndicator, dissection, snapshot);
		} catch (PeriodUnresolvableException ex) {
			logger.warn("Period unresolvable: {}", ex.getMessage());
			return ResolutionResult.failed(FailureType.PERIOD_UNRESOLVABLE, ex.getMessage(), ex.getExamples());
		}
		if (deadline.isExpired()) {
			return timedOut(List.of(company.company().name(), period.label()));
		}

		MetricValidation validation = metricHeadValidator.validate(new MetricValidationRequest(
				request.metricPhrase(), company, period, consolidation.get().consolidationId(),
				ratioIndicator, dissection), snapshot, deadline);
		switch (validation.status()) {
			case METRIC_NOT_FOUND -> {
				return ResolutionResult.failed(FailureType.METRIC_NOT_FOUND,
						"No metric matches '" + request.metricPhrase() + "'", validation.suggestions());
			}
			case METRIC_NO_DATA -> {
				return ResolutionResult.failed(FailureType.METRIC_NO_DATA,
						"No data for '" + request.metricPhrase() + "' for " + company.company().name()
								+ " in " + period.label(), validation.suggestions());
			}
			case TIMED_OUT -> {
				return timedOut(validation.suggestions());
			}
			case ACCEPTED -> {
				// handled below
			}
		}

		HeadCandidate accepted = validation.accepted();
		ResolvedQuerySpec spec = new ResolvedQuerySpec(company.companyId(), accepted.head(), accepted.kind(), period,
				consolidation.get().consolidationId(), accepted.axis());
		QuerySpec query = queryBuilder.build(spec);
		List<Map<String, Object>> rows = queryExecutor.fetch(query);
		logger.info("Resolved query for {} / {} / {}: {} rows from {}.", company.company().name(),
				accepted.head().name(), period.label(), rows.size(), query.table().tableName());
		return ResolutionResult.resolved(spec, query, rows,
				answerContext(company, accepted, period, consolidation.get(), dissection, snapshot));
	}

	private Optional<ConsolidationType> consolidation(String phrase, MetadataSnapshot snapshot) {
		String trimmed = TextNormalizer.trimToNull(phrase);
		if (trimmed == null) {
			return snapshot.consolidationByLabel(defaultConsolidation);
		}
		Optional<ConsolidationType> direct = snapshot.consolidationByLabel(trimmed);
		if (direct.isPresent()) {
			return direct;
		}
		Optional<LexiconMatch> synonym = lexicon.detectConsolidation(TextNormalizer.normalize(trimmed));
		return synonym.flatMap(match -> snapshot.consolidationByLabel(match.label()));
	}

	private ResolutionResult timedOut(List<String> suggestions) {
		logger.warn("Resolution abandoned after {}.", requestTimeout);
		return ResolutionResult.failed(FailureType.TIMED_OUT, "Resolution timed out after " + requestTimeout, suggestions);
	}

	private AnswerContext answerContext(CompanyContext company,
										HeadCandidate accepted,
										ResolvedPeriod period,
										ConsolidationType consolidation,
										DissectionMatch dissection,
										MetadataSnapshot snapshot) {
		String kind = accepted.kind().type().name().toLowerCase(Locale.ROOT);
		String metricName = accepted.head().name();
		if (accepted.kind().isDissection()) {
			String group = snapshot.dissectionGroup(accepted.kind().dissectionGroupId())
					.map(DissectionGroup::label)
					.orElse(dissection == null ? kind : dissection.group().label());
			metricName = metricName + " (" + group + ")";
		}
		String unit = accepted.kind().isDissection()
				? null
				: snapshot.unit(accepted.head().unitId()).map(Unit::label).orElse(null);
		return new AnswerContext(
				company.company().name(),
				company.company().ticker(),
				metricName,
				kind,
				unit,
				period.label(),
				consolidation.label()
		);
	}
}
