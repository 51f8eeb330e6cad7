package my.finresolver.app.domain;

public enum PeriodBasis {
	STANDARD,
	QUARTERLY,
	TTM
}
