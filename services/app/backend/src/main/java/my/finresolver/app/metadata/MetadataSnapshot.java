package my.finresolver.app.metadata;

import my.finresolver.app.domain.Company;
import my.finresolver.app.domain.ConsolidationType;
import my.finresolver.app.domain.DissectionGroup;
import my.finresolver.app.domain.HeadFamily;
import my.finresolver.app.domain.Industry;
import my.finresolver.app.domain.IndustrySectorMapping;
import my.finresolver.app.domain.MetricHead;
import my.finresolver.app.domain.Sector;
import my.finresolver.app.domain.Term;
import my.finresolver.app.domain.Unit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable, indexed view over one generation of reference tables. Safe to share between threads.
 */
public final class MetadataSnapshot {
	private final List<Company> companies;
	private final Map<Long, Company> companiesById;
	private final Map<String, Company> companiesByTicker;
	private final Map<Long, Sector> sectorsById;
	private final Map<Long, Industry> industriesById;
	private final Map<Long, Set<Long>> industriesBySector;
	private final Map<HeadFamily, List<MetricHead>> headsByFamily;
	private final Map<HeadFamily, Map<Long, MetricHead>> headsById;
	private final List<Term> terms;
	private final Map<Long, Term> termsById;
	private final Map<String, Term> termsByLabel;
	private final Map<Long, ConsolidationType> consolidationsById;
	private final Map<String, ConsolidationType> consolidationsByLabel;
	private final Map<Long, Unit> unitsById;
	private final Map<Long, DissectionGroup> dissectionGroupsById;
	private final Instant loadedAt;

	public MetadataSnapshot(MetadataTables tables, Instant loadedAt) {
		this.companies = tables.companies();
		this.companiesById = index(tables.companies(), Company::companyId);
		Map<String, Company> byTicker = new HashMap<>();
		for (Company company : tables.companies()) {
			if (company.ticker() != null && !company.ticker().isBlank()) {
				byTicker.putIfAbsent(tickerKey(company.ticker()), company);
			}
		}
		this.companiesByTicker = Collections.unmodifiableMap(byTicker);
		this.sectorsById = index(tables.sectors(), Sector::sectorId);
		this.industriesById = index(tables.industries(), Industry::industryId);

		Map<Long, Set<Long>> bySector = new HashMap<>();
		for (IndustrySectorMapping mapping : tables.industrySectorMappings()) {
			bySector.computeIfAbsent(mapping.sectorId(), key -> new LinkedHashSet<>()).add(mapping.industryId());
		}
		Map<Long, Set<Long>> frozen = new HashMap<>();
		bySector.forEach((sectorId, industries) -> frozen.put(sectorId, Collections.unmodifiableSet(industries)));
		this.industriesBySector = Collections.unmodifiableMap(frozen);

		Map<HeadFamily, List<MetricHead>> families = new EnumMap<>(HeadFamily.class);
		families.put(HeadFamily.REGULAR, tables.heads());
		families.put(HeadFamily.RATIO, tables.ratioHeads());
		this.headsByFamily = Collections.unmodifiableMap(families);
		Map<HeadFamily, Map<Long, MetricHead>> familyIndex = new EnumMap<>(HeadFamily.class);
		familyIndex.put(HeadFamily.REGULAR, index(tables.heads(), MetricHead::headId));
		familyIndex.put(HeadFamily.RATIO, index(tables.ratioHeads(), MetricHead::headId));
		this.headsById = Collections.unmodifiableMap(familyIndex);

		this.terms = tables.terms();
		this.termsById = index(tables.terms(), Term::termId);
		this.termsByLabel = index(tables.terms(), term -> labelKey(term.label()));
		this.consolidationsById = index(tables.consolidations(), ConsolidationType::consolidationId);
		this.consolidationsByLabel = index(tables.consolidations(), type -> labelKey(type.label()));
		this.unitsById = index(tables.units(), Unit::unitId);
		this.dissectionGroupsById = index(tables.dissectionGroups(), DissectionGroup::groupId);
		this.loadedAt = loadedAt;
	}

	private static <K, V> Map<K, V> index(List<V> rows, Function<V, K> key) {
		Map<K, V> map = new LinkedHashMap<>();
		for (V row : rows) {
			map.putIfAbsent(key.apply(row), row);
		}
		return Collections.unmodifiableMap(map);
	}

	private static String tickerKey(String ticker) {
		return ticker.trim().toUpperCase(Locale.ROOT);
	}

	private static String labelKey(String label) {
		return label == null ? "" : label.trim().toLowerCase(Locale.ROOT);
	}

	public List<Company> companies() {
		return companies;
	}

	public Optional<Company> company(long companyId) {
		return Optional.ofNullable(companiesById.get(companyId));
	}

	public Optional<Company> companyByTicker(String ticker) {
		if (ticker == null || ticker.isBlank()) {
			return Optional.empty();
		}
		return Optional.ofNullable(companiesByTicker.get(tickerKey(ticker)));
	}

	public Optional<Sector> sector(long sectorId) {
		return Optional.ofNullable(sectorsById.get(sectorId));
	}

	public Optional<Industry> industry(long industryId) {
		return Optional.ofNullable(industriesById.get(industryId));
	}

	public Set<Long> industriesForSector(long sectorId) {
		return industriesBySector.getOrDefault(sectorId, Set.of());
	}

	public List<MetricHead> heads(HeadFamily family) {
		return headsByFamily.getOrDefault(family, List.of());
	}

	public Optional<MetricHead> head(HeadFamily family, long headId) {
		return Optional.ofNullable(headsById.getOrDefault(family, Map.of()).get(headId));
	}

	public List<String> headNames() {
		Set<String> names = new LinkedHashSet<>();
		for (List<MetricHead> heads : headsByFamily.values()) {
			for (MetricHead head : heads) {
				names.add(head.name());
			}
		}
		return new ArrayList<>(names);
	}

	public List<Term> terms() {
		return terms;
	}

	public Optional<Term> term(long termId) {
		return Optional.ofNullable(termsById.get(termId));
	}

	public Optional<Term> termByLabel(String label) {
		return Optional.ofNullable(termsByLabel.get(labelKey(label)));
	}

	public Optional<ConsolidationType> consolidation(long consolidationId) {
		return Optional.ofNullable(consolidationsById.get(consolidationId));
	}

	public Optional<ConsolidationType> consolidationByLabel(String label) {
		return Optional.ofNullable(consolidationsByLabel.get(labelKey(label)));
	}

	public Optional<Unit> unit(Long unitId) {
		if (unitId == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(unitsById.get(unitId));
	}

	public Optional<DissectionGroup> dissectionGroup(long groupId) {
		return Optional.ofNullable(dissectionGroupsById.get(groupId));
	}

	public Instant loadedAt() {
		return loadedAt;
	}
}
