package my.finresolver.app;

import my.finresolver.app.metadata.MetadataCache;
import my.finresolver.app.resolve.CompanyResolver;
import my.finresolver.app.resolve.EntityExtractor;
import my.finresolver.app.resolve.MetricHeadValidator;
import my.finresolver.app.service.FinancialQueryResolver;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class AppApplicationTests {
	@Autowired
	private MetadataCache metadataCache;

	@Autowired
	private ApplicationContext context;

	@Test
	void contextLoads() {
		assertThat(metadataCache.current().companies()).isNotEmpty();
	}

	@Test
	void resolverComponentsAreWiredFromProperties() {
		assertThat(context.getBean(EntityExtractor.class)).isNotNull();
		assertThat(context.getBean(CompanyResolver.class)).isNotNull();
		assertThat(context.getBean(MetricHeadValidator.class)).isNotNull();
		assertThat(context.getBean(FinancialQueryResolver.class)).isNotNull();
	}
}
