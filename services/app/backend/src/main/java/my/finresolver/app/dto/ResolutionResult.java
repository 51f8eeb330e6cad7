package my.finresolver.app.dto;

import my.finresolver.app.domain.ResolvedQuerySpec;
import my.finresolver.app.query.QuerySpec;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one resolution: either the validated spec with its query and rows, or a failure with
 * suggestions. Low-confidence fragment names are reported in both cases.
 */
public record ResolutionResult(
		ResolvedQuerySpec spec,
		QuerySpec query,
		List<Map<String, Object>> rows,
		AnswerContext answer,
		ResolutionFailure failure,
		List<String> lowConfidenceFragments
) {
	public ResolutionResult {
		rows = rows == null ? List.of() : Collections.unmodifiableList(rows);
		lowConfidenceFragments = lowConfidenceFragments == null ? List.of() : List.copyOf(lowConfidenceFragments);
	}

	public static ResolutionResult resolved(ResolvedQuerySpec spec,
											QuerySpec query,
											List<Map<String, Object>> rows,
											AnswerContext answer) {
		return new ResolutionResult(spec, query, rows, answer, null, List.of());
	}

	public static ResolutionResult failed(FailureType type, String message, List<String> suggestions) {
		return new ResolutionResult(null, null, List.of(), null, new ResolutionFailure(type, message, suggestions),
				List.of());
	}

	public ResolutionResult withLowConfidence(List<String> fragments) {
		return new ResolutionResult(spec, query, rows, answer, failure, fragments);
	}

	public boolean isResolved() {
		return failure == null;
	}
}
