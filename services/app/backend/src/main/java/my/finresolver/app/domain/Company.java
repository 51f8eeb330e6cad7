package my.finresolver.app.domain;

public record Company(
		long companyId,
		String name,
		String ticker,
		long sectorId,
		Long industryId,
		int fiscalYearEndMonth
) {
	public Company {
		if (fiscalYearEndMonth < 1 || fiscalYearEndMonth > 12) {
			fiscalYearEndMonth = 12;
		}
	}
}
