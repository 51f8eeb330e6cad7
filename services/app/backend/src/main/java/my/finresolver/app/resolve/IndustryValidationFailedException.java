package my.finresolver.app.resolve;

/**
 * Raised when a company has no industry to filter metric heads by. Only used inside the validator.
 */
class IndustryValidationFailedException extends RuntimeException {
	IndustryValidationFailedException(String message) {
		super(message);
	}
}
