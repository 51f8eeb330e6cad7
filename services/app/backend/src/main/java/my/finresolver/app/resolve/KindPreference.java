package my.finresolver.app.resolve;

import my.finresolver.app.domain.MetricKind;

import java.util.List;

/**
 * Order in which head kinds are searched within one cascade step.
 * <ul>
 *     <li>dissection and ratio indicator: dissection, ratio, regular</li>
 *     <li>dissection indicator only: dissection, regular, ratio</li>
 *     <li>ratio indicator only: ratio, regular</li>
 *     <li>no indicator: regular, ratio</li>
 * </ul>
 */
public final class KindPreference {
	private KindPreference() {
	}

	public static List<MetricKind.Type> order(boolean ratioIndicator, boolean dissectionIndicator) {
		if (dissectionIndicator && ratioIndicator) {
			return List.of(MetricKind.Type.DISSECTION, MetricKind.Type.RATIO, MetricKind.Type.REGULAR);
		}
		if (dissectionIndicator) {
			return List.of(MetricKind.Type.DISSECTION, MetricKind.Type.REGULAR, MetricKind.Type.RATIO);
		}
		if (ratioIndicator) {
			return List.of(MetricKind.Type.RATIO, MetricKind.Type.REGULAR);
		}
		return List.of(MetricKind.Type.REGULAR, MetricKind.Type.RATIO);
	}
}
