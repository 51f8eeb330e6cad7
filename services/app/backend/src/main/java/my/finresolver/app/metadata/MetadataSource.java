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
 * Supplies the reference tables backing the metadata cache. Implementations throw unchecked
 * exceptions when a table cannot be read.
 */
public interface MetadataSource {
	List<Company> companies();

	List<Sector> sectors();

	List<Industry> industries();

	List<IndustrySectorMapping> industrySectorMappings();

	List<MetricHead> heads();

	List<MetricHead> ratioHeads();

	List<Term> terms();

	List<ConsolidationType> consolidations();

	List<Unit> units();

	List<DissectionGroup> dissectionGroups();

	String describe();
}
