package my.finresolver.app.metadata;

import jakarta.annotation.PostConstruct;
import my.finresolver.app.domain.HeadFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holds the current {@link MetadataSnapshot}. A refresh builds a complete new snapshot and swaps it in
 * with a single reference write, so readers either see the old or the new generation.
 */
@Component
public class MetadataCache {
	private static final Logger logger = LoggerFactory.getLogger(MetadataCache.class);

	private final MetadataSource source;
	private final Clock clock;
	private final AtomicReference<MetadataSnapshot> current = new AtomicReference<>();

	public MetadataCache(MetadataSource source, Clock clock) {
		this.source = source;
		this.clock = clock;
	}

	@PostConstruct
	public void initialize() {
		refresh();
	}

	public MetadataSnapshot current() {
		MetadataSnapshot snapshot = current.get();
		if (snapshot == null) {
			throw new IllegalStateException("Metadata cache has not been loaded");
		}
		return snapshot;
	}

	public MetadataSnapshot refresh() {
		MetadataSnapshot snapshot = load();
		current.set(snapshot);
		logger.info("Metadata snapshot loaded from {} ({} companies, {} heads, {} ratio heads, {} terms).",
				source.describe(),
				snapshot.companies().size(),
				snapshot.heads(HeadFamily.REGULAR).size(),
				snapshot.heads(HeadFamily.RATIO).size(),
				snapshot.terms().size());
		return snapshot;
	}

	public MetadataSnapshot load() {
		MetadataTables tables = new MetadataTables(
				read("companies", source::companies),
				read("sectors", source::sectors),
				read("industries", source::industries),
				read("industry_sector_mapping", source::industrySectorMappings),
				read("heads", source::heads),
				read("ratio_heads", source::ratioHeads),
				read("terms", source::terms),
				read("consolidations", source::consolidations),
				read("units", source::units),
				read("dissection_groups", source::dissectionGroups)
		);
		requireRows("companies", tables.companies());
		requireRows("terms", tables.terms());
		requireRows("consolidations", tables.consolidations());
		return new MetadataSnapshot(tables, clock.instant());
	}

	private <T> List<T> read(String table, Supplier<List<T>> reader) {
		try {
			List<T> rows = reader.get();
			return rows == null ? List.of() : rows;
		} catch (MetadataLoadException ex) {
			throw ex;
		} catch (RuntimeException ex) {
			throw new MetadataLoadException(table,
					"Failed to read " + table + " from " + source.describe() + ": " + ex.getMessage(), ex);
		}
	}

	private void requireRows(String table, List<?> rows) {
		if (rows.isEmpty()) {
			throw new MetadataLoadException(table, "Required lookup table " + table + " is empty in " + source.describe());
		}
	}
}
