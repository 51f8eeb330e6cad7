package my.finresolver.app.lexicon;

import my.finresolver.app.domain.DataAxis;
import my.finresolver.app.util.TextNormalizer;

import java.util.List;

/**
 * Keyword indicators for one dissection group and the data axis its values live on when the period
 * does not force one.
 */
public record DissectionGroupDefinition(
		long groupId,
		String label,
		DataAxis dataAxis,
		List<String> indicators
) {
	public DissectionGroupDefinition {
		dataAxis = dataAxis == null ? DataAxis.REGULAR : dataAxis;
		indicators = indicators == null ? List.of() : indicators.stream().map(TextNormalizer::normalize).toList();
	}
}
