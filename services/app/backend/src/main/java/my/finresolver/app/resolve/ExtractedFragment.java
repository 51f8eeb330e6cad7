package my.finresolver.app.resolve;

public record ExtractedFragment(String text, double confidence, boolean lowConfidence) {
	private static final ExtractedFragment ABSENT = new ExtractedFragment(null, 0.0, true);

	public static ExtractedFragment of(String text, double confidence, double threshold) {
		if (text == null || text.isBlank()) {
			return ABSENT;
		}
		double bounded = Math.max(0.0, Math.min(1.0, confidence));
		return new ExtractedFragment(text.trim(), bounded, bounded < threshold);
	}

	public static ExtractedFragment absent() {
		return ABSENT;
	}

	public boolean isPresent() {
		return text != null;
	}
}
