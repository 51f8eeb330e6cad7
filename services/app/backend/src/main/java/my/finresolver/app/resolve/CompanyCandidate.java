package my.finresolver.app.resolve;

import my.finresolver.app.domain.Company;

public record CompanyCandidate(Company company, double score) {
}
