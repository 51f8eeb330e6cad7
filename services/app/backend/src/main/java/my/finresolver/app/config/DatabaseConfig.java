package my.finresolver.app.config;

import liquibase.integration.spring.SpringLiquibase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.support.DatabaseStartupValidator;

import javax.sql.DataSource;

/**
 * Waits for the warehouse to accept connections, then applies the warehouse changelog before anything
 * reads the lookup tables. Set {@code spring.liquibase.enabled=false} when the schema is managed elsewhere.
 */
@Configuration
@EnableConfigurationProperties(DatabaseConfig.WarehouseSchema.class)
public class DatabaseConfig {
	private static final Logger logger = LoggerFactory.getLogger(DatabaseConfig.class);

	@Bean
	public DatabaseStartupValidator databaseStartupValidator(DataSource dataSource, AppProperties properties) {
		AppProperties.Warehouse warehouse = properties.warehouse();
		DatabaseStartupValidator validator = new DatabaseStartupValidator();
		validator.setDataSource(dataSource);
		validator.setTimeout(Math.toIntExact(warehouse.startupTimeout().toSeconds()));
		validator.setInterval(Math.toIntExact(Math.max(1, warehouse.startupCheckInterval().toSeconds())));
		logger.debug("Waiting up to {} for the warehouse connection.", warehouse.startupTimeout());
		return validator;
	}

	@Bean
	@DependsOn("databaseStartupValidator")
	public SpringLiquibase liquibase(DataSource dataSource, WarehouseSchema schema) {
		SpringLiquibase liquibase = new SpringLiquibase();
		liquibase.setDataSource(dataSource);
		liquibase.setChangeLog(schema.changeLog());
		if (schema.contexts() != null) {
			liquibase.setContexts(schema.contexts());
		}
		liquibase.setShouldRun(schema.enabled());
		logger.info("Warehouse schema changelog {} (enabled={}).", schema.changeLog(), schema.enabled());
		return liquibase;
	}

	@ConfigurationProperties(prefix = "spring.liquibase")
	public record WarehouseSchema(String changeLog, String contexts, Boolean enabled) {
		static final String DEFAULT_CHANGE_LOG = "classpath:db/changelog/db.changelog-master.yaml";

		public WarehouseSchema {
			if (changeLog == null || changeLog.isBlank()) {
				changeLog = DEFAULT_CHANGE_LOG;
			}
			if (contexts != null && contexts.isBlank()) {
				contexts = null;
			}
			if (enabled == null) {
				enabled = Boolean.TRUE;
			}
		}
	}
}
