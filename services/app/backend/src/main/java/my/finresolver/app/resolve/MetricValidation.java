package my.finresolver.app.resolve;

import java.util.ArrayList;
import java.util.List;

public record MetricValidation(
		Status status,
		HeadCandidate accepted,
		long dataCount,
		List<HeadCandidate> emptyCandidates,
		List<String> suggestions,
		int checks
) {
	public enum Status {
		ACCEPTED,
		METRIC_NOT_FOUND,
		METRIC_NO_DATA,
		TIMED_OUT
	}

	public MetricValidation {
		emptyCandidates = emptyCandidates == null ? List.of() : List.copyOf(emptyCandidates);
		suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
	}

	public static MetricValidation accepted(HeadCandidate candidate, long count, List<HeadCandidate> empty, int checks) {
		return new MetricValidation(Status.ACCEPTED, candidate, count, empty, List.of(), checks);
	}

	public static MetricValidation notFound(List<String> nearestNames) {
		return new MetricValidation(Status.METRIC_NOT_FOUND, null, 0, List.of(), nearestNames, 0);
	}

	public static MetricValidation noData(List<HeadCandidate> empty, int checks) {
		return new MetricValidation(Status.METRIC_NO_DATA, null, 0, empty, names(empty), checks);
	}

	/**
	 * @param pending the candidate that was next in line when time ran out
	 */
	public static MetricValidation timedOut(List<HeadCandidate> empty, HeadCandidate pending, int checks) {
		List<String> suggestions = new ArrayList<>();
		if (pending != null) {
			suggestions.add(pending.describe());
		}
		suggestions.addAll(names(empty));
		return new MetricValidation(Status.TIMED_OUT, null, 0, empty, suggestions, checks);
	}

	public boolean isAccepted() {
		return status == Status.ACCEPTED;
	}

	private static List<String> names(List<HeadCandidate> candidates) {
		return candidates.stream().map(HeadCandidate::describe).distinct().toList();
	}
}
