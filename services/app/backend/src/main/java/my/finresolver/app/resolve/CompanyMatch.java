package my.finresolver.app.resolve;

import java.util.List;

public record CompanyMatch(Status status, CompanyContext context, List<CompanyCandidate> candidates) {
	public enum Status {
		RESOLVED,
		AMBIGUOUS,
		NOT_FOUND
	}

	public CompanyMatch {
		candidates = candidates == null ? List.of() : List.copyOf(candidates);
	}

	public static CompanyMatch resolved(CompanyContext context) {
		return new CompanyMatch(Status.RESOLVED, context, List.of());
	}

	public static CompanyMatch ambiguous(List<CompanyCandidate> candidates) {
		return new CompanyMatch(Status.AMBIGUOUS, null, candidates);
	}

	public static CompanyMatch notFound(List<CompanyCandidate> suggestions) {
		return new CompanyMatch(Status.NOT_FOUND, null, suggestions);
	}

	public boolean isResolved() {
		return status == Status.RESOLVED;
	}

	public List<String> candidateNames() {
		return candidates.stream().map(candidate -> candidate.company().name()).toList();
	}
}
