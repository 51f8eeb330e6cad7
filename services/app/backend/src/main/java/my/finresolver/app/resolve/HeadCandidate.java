package my.finresolver.app.resolve;

import my.finresolver.app.domain.DataAxis;
import my.finresolver.app.domain.MetricHead;
import my.finresolver.app.domain.MetricKind;

public record HeadCandidate(MetricHead head, MetricKind kind, DataAxis axis) {
	public String describe() {
		return head.name() + " [" + kind + ", head " + head.headId() + "]";
	}
}
