package my.finresolver.app.domain;

/**
 * Table family a data point is read from.
 */
public enum DataAxis {
	REGULAR,
	QUARTERLY,
	TTM,
	RATIO;

	public static DataAxis forBasis(PeriodBasis basis) {
		if (basis == null) {
			return REGULAR;
		}
		return switch (basis) {
			case QUARTERLY -> QUARTERLY;
			case TTM -> TTM;
			case STANDARD -> REGULAR;
		};
	}
}
