package my.finresolver.app.metadata;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import my.finresolver.app.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "app.metadata.refresh-scheduler-enabled", havingValue = "true")
public class MetadataRefreshScheduler {
	private static final Logger logger = LoggerFactory.getLogger(MetadataRefreshScheduler.class);
	private static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(15);

	private final MetadataCache metadataCache;
	private final long intervalSeconds;
	private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();

	public MetadataRefreshScheduler(MetadataCache metadataCache, AppProperties properties) {
		this.metadataCache = metadataCache;
		Duration interval = properties.metadata().refreshInterval();
		this.intervalSeconds = (interval == null || interval.isZero() || interval.isNegative()
				? DEFAULT_INTERVAL
				: interval).toSeconds();
	}

	@PostConstruct
	public void schedule() {
		scheduleNext();
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private void scheduleNext() {
		executor.schedule(this::runOnce, Math.max(1, intervalSeconds), TimeUnit.SECONDS);
	}

	void runOnce() {
		try {
			metadataCache.refresh();
		} catch (RuntimeException ex) {
			logger.warn("Metadata refresh failed, keeping snapshot from {}: {}",
					metadataCache.current().loadedAt(), ex.getMessage());
		} finally {
			if (!executor.isShutdown()) {
				scheduleNext();
			}
		}
	}
}
