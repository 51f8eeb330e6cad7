package my.finresolver.app.resolve;

import java.util.List;

public class PeriodUnresolvableException extends RuntimeException {
	private final String phrase;
	private final List<String> examples;

	public PeriodUnresolvableException(String phrase, String message, List<String> examples) {
		super(message);
		this.phrase = phrase;
		this.examples = examples == null ? List.of() : List.copyOf(examples);
	}

	public String getPhrase() {
		return phrase;
	}

	public List<String> getExamples() {
		return examples;
	}
}
