package my.finresolver.app.dto;

public enum FailureType {
	COMPANY_NOT_FOUND,
	AMBIGUOUS_COMPANY,
	PERIOD_UNRESOLVABLE,
	METRIC_NOT_FOUND,
	METRIC_NO_DATA,
	MISSING_FRAGMENT,
	TIMED_OUT
}
