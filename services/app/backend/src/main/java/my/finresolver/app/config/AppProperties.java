package my.finresolver.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Resolver resolver,
		@Valid @NotNull Metadata metadata,
		@Valid @NotNull Warehouse warehouse
) {
	public record Resolver(
			@DecimalMin("0.0") @DecimalMax("1.0") double companyMatchThreshold,
			@Min(1) int maxSuggestions,
			@DecimalMin("0.0") @DecimalMax("1.0") double minFragmentConfidence,
			@NotNull Duration requestTimeout,
			@NotBlank String defaultConsolidation,
			@NotBlank String lexiconLocation,
			@Min(0) int queryTimeoutSeconds
	) {
	}

	public record Metadata(
			@NotBlank String source,
			String csvLocation,
			boolean refreshSchedulerEnabled,
			Duration refreshInterval
	) {
	}

	/**
	 * How long startup waits for the warehouse connection before the schema changelog runs.
	 */
	public record Warehouse(
			@NotNull Duration startupTimeout,
			@NotNull Duration startupCheckInterval
	) {
		public Warehouse {
			if (startupTimeout == null) {
				startupTimeout = Duration.ofSeconds(60);
			}
			if (startupCheckInterval == null) {
				startupCheckInterval = Duration.ofSeconds(5);
			}
		}
	}
}
