package my.finresolver.app.resolve;

import my.finresolver.app.domain.Company;
import my.finresolver.app.domain.Sector;

import java.util.Set;

/**
 * A resolved company with the industries its metric heads may belong to.
 */
public record CompanyContext(Company company, Sector sector, Set<Long> industryIds) {
	public CompanyContext {
		industryIds = industryIds == null ? Set.of() : Set.copyOf(industryIds);
	}

	public long companyId() {
		return company.companyId();
	}

	public boolean hasIndustryContext() {
		return !industryIds.isEmpty();
	}
}
