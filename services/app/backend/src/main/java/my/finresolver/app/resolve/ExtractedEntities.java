package my.finresolver.app.resolve;

import my.finresolver.app.lexicon.DissectionMatch;

import java.util.ArrayList;
import java.util.List;

public record ExtractedEntities(
		String rawQuery,
		ExtractedFragment company,
		ExtractedFragment metric,
		ExtractedFragment period,
		ExtractedFragment consolidation,
		boolean hasRelativePeriod,
		boolean hasRatioIndicator,
		DissectionMatch dissection
) {
	public boolean hasDissectionIndicator() {
		return dissection != null;
	}

	public String dissectionGroupLabel() {
		return dissection == null ? null : dissection.group().label();
	}

	public List<String> lowConfidenceFragments() {
		List<String> names = new ArrayList<>();
		if (company.lowConfidence()) {
			names.add("company");
		}
		if (metric.lowConfidence()) {
			names.add("metric");
		}
		if (period.lowConfidence()) {
			names.add("period");
		}
		if (consolidation.lowConfidence()) {
			names.add("consolidation");
		}
		return names;
	}
}
