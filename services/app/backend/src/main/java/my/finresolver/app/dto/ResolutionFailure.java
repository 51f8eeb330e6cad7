package my.finresolver.app.dto;

import java.util.List;

public record ResolutionFailure(FailureType type, String message, List<String> suggestions) {
	public ResolutionFailure {
		suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
	}
}
