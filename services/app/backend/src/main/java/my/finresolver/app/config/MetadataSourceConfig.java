package my.finresolver.app.config;

import my.finresolver.app.metadata.CsvMetadataSource;
import my.finresolver.app.metadata.JdbcMetadataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class MetadataSourceConfig {
	private static final Logger logger = LoggerFactory.getLogger(MetadataSourceConfig.class);

	@Bean
	@DependsOn("liquibase")
	@ConditionalOnProperty(name = "app.metadata.source", havingValue = "jdbc", matchIfMissing = true)
	public JdbcMetadataSource jdbcMetadataSource(JdbcTemplate jdbcTemplate) {
		logger.info("Metadata source: warehouse lookup tables.");
		return new JdbcMetadataSource(jdbcTemplate);
	}

	@Bean
	@ConditionalOnProperty(name = "app.metadata.source", havingValue = "csv")
	public CsvMetadataSource csvMetadataSource(AppProperties properties, ResourceLoader resourceLoader) {
		String location = properties.metadata().csvLocation();
		if (location == null || location.isBlank()) {
			throw new IllegalStateException("app.metadata.csv-location is required when app.metadata.source=csv");
		}
		logger.info("Metadata source: csv exports at {}.", location);
		return new CsvMetadataSource(resourceLoader, location);
	}
}
