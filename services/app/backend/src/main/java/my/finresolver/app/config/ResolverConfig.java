package my.finresolver.app.config;

import my.finresolver.app.lexicon.FinancialLexicon;
import my.finresolver.app.lexicon.LexiconParser;
import my.finresolver.app.query.JdbcQueryExecutor;
import my.finresolver.app.query.QueryExecutor;
import my.finresolver.app.query.SqlRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

import javax.sql.DataSource;

@Configuration
public class ResolverConfig {
	private static final Logger logger = LoggerFactory.getLogger(ResolverConfig.class);

	@Bean
	@ConditionalOnMissingBean(Clock.class)
	public Clock clock() {
		return Clock.systemDefaultZone();
	}

	@Bean
	public FinancialLexicon financialLexicon(AppProperties properties, ResourceLoader resourceLoader) throws IOException {
		Resource resource = resourceLoader.getResource(properties.resolver().lexiconLocation());
		String content;
		try (InputStream in = resource.getInputStream()) {
			content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
		FinancialLexicon lexicon = new LexiconParser().parse(content);
		logger.info("Lexicon loaded from {} ({} metric aliases, {} dissection groups).",
				resource.getDescription(), lexicon.metricAliases().size(), lexicon.dissectionGroups().size());
		return lexicon;
	}

	@Bean
	@ConditionalOnMissingBean(QueryExecutor.class)
	public QueryExecutor queryExecutor(DataSource dataSource, SqlRenderer renderer, AppProperties properties) {
		return new JdbcQueryExecutor(dataSource, renderer, properties.resolver().queryTimeoutSeconds());
	}
}
