package my.finresolver.app.metadata;

import my.finresolver.app.domain.Company;
import my.finresolver.app.domain.ConsolidationType;
import my.finresolver.app.domain.DissectionGroup;
import my.finresolver.app.domain.Industry;
import my.finresolver.app.domain.IndustrySectorMapping;
import my.finresolver.app.domain.MetricHead;
import my.finresolver.app.domain.Sector;
import my.finresolver.app.domain.Term;
import my.finresolver.app.domain.Unit;

import java.util.List;

/**
 * Raw reference table rows as read from a {@link MetadataSource}.
 */
public record MetadataTables(
		List<Company> companies,
		List<Sector> sectors,
		List<Industry> industries,
		List<IndustrySectorMapping> industrySectorMappings,
		List<MetricHead> heads,
		List<MetricHead> ratioHeads,
		List<Term> terms,
		List<ConsolidationType> consolidations,
		List<Unit> units,
		List<DissectionGroup> dissectionGroups
) {
	public MetadataTables {
		companies = copy(companies);
		sectors = copy(sectors);
		industries = copy(industries);
		industrySectorMappings = copy(industrySectorMappings);
		heads = copy(heads);
		ratioHeads = copy(ratioHeads);
		terms = copy(terms);
		consolidations = copy(consolidations);
		units = copy(units);
		dissectionGroups = copy(dissectionGroups);
	}

	private static <T> List<T> copy(List<T> rows) {
		return rows == null ? List.of() : List.copyOf(rows);
	}
}
