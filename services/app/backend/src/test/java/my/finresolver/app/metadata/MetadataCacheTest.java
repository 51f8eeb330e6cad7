package my.finresolver.app.metadata;

import my.finresolver.app.domain.Company;
import my.finresolver.app.domain.ConsolidationType;
import my.finresolver.app.domain.DissectionGroup;
import my.finresolver.app.domain.HeadFamily;
import my.finresolver.app.domain.Industry;
import my.finresolver.app.domain.IndustrySectorMapping;
import my.finresolver.app.domain.MetricHead;
import my.finresolver.app.domain.Sector;
import my.finresolver.app.domain.Term;
import my.finresolver.app.domain.Unit;
import my.finresolver.app.support.MutableClock;
import my.finresolver.app.support.TestFixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetadataCacheTest {
	private final MutableClock clock = new MutableClock(TestFixtures.LOADED_AT);

	@Test
	void current_failsBeforeFirstLoad() {
		MetadataCache cache = new MetadataCache(new TablesSource(TestFixtures.tables()), clock);

		assertThatThrownBy(cache::current)
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("not been loaded");
	}

	@Test
	void initialize_buildsIndexedSnapshot() {
		MetadataCache cache = new MetadataCache(new TablesSource(TestFixtures.tables()), clock);

		cache.initialize();

		MetadataSnapshot snapshot = cache.current();
		assertThat(snapshot.companies()).hasSize(6);
		assertThat(snapshot.companyByTicker("ubl")).map(Company::name).contains("United Bank Limited");
		assertThat(snapshot.industriesForSector(1)).containsExactly(10L, 11L);
		assertThat(snapshot.heads(HeadFamily.RATIO)).extracting(MetricHead::name).contains("Return on Equity");
		assertThat(snapshot.termByLabel("q2")).map(Term::termId).contains(6L);
		assertThat(snapshot.consolidationByLabel("UNCONSOLIDATED")).map(ConsolidationType::consolidationId).contains(2L);
		assertThat(snapshot.unit(null)).isEmpty();
		assertThat(snapshot.loadedAt()).isEqualTo(TestFixtures.LOADED_AT);
	}

	@Test
	void refresh_swapsInNewGenerationWithoutTouchingOldSnapshot() {
		TablesSource source = new TablesSource(TestFixtures.tables());
		MetadataCache cache = new MetadataCache(source, clock);
		cache.initialize();
		MetadataSnapshot before = cache.current();

		List<Company> companies = new ArrayList<>(before.companies());
		companies.add(new Company(100, "Zeta Holdings Limited", "ZETA", 1, null, 12));
		source.tables = withCompanies(TestFixtures.tables(), companies);
		clock.advance(Duration.ofMinutes(15));
		cache.refresh();

		assertThat(cache.current()).isNotSameAs(before);
		assertThat(cache.current().companyByTicker("ZETA")).isPresent();
		assertThat(cache.current().loadedAt()).isAfter(before.loadedAt());
		assertThat(before.companyByTicker("ZETA")).isEmpty();
	}

	@Test
	void refresh_failureKeepsPreviousSnapshot() {
		TablesSource source = new TablesSource(TestFixtures.tables());
		MetadataCache cache = new MetadataCache(source, clock);
		cache.initialize();
		MetadataSnapshot before = cache.current();

		source.failOn = "terms";

		assertThatThrownBy(cache::refresh)
				.isInstanceOf(MetadataLoadException.class)
				.satisfies(ex -> assertThat(((MetadataLoadException) ex).getTable()).isEqualTo("terms"));
		assertThat(cache.current()).isSameAs(before);
	}

	@Test
	void load_rejectsEmptyRequiredTable() {
		TablesSource source = new TablesSource(withCompanies(TestFixtures.tables(), List.of()));
		MetadataCache cache = new MetadataCache(source, clock);

		assertThatThrownBy(cache::initialize)
				.isInstanceOf(MetadataLoadException.class)
				.hasMessageContaining("companies");
	}

	private static MetadataTables withCompanies(MetadataTables tables, List<Company> companies) {
		return new MetadataTables(companies, tables.sectors(), tables.industries(), tables.industrySectorMappings(),
				tables.heads(), tables.ratioHeads(), tables.terms(), tables.consolidations(), tables.units(),
				tables.dissectionGroups());
	}

	private static final class TablesSource implements MetadataSource {
		private MetadataTables tables;
		private String failOn;

		private TablesSource(MetadataTables tables) {
			this.tables = tables;
		}

		private <T> List<T> table(String name, List<T> rows) {
			if (name.equals(failOn)) {
				throw new IllegalStateException("connection reset");
			}
			return rows;
		}

		@Override
		public List<Company> companies() {
			return table("companies", tables.companies());
		}

		@Override
		public List<Sector> sectors() {
			return table("sectors", tables.sectors());
		}

		@Override
		public List<Industry> industries() {
			return table("industries", tables.industries());
		}

		@Override
		public List<IndustrySectorMapping> industrySectorMappings() {
			return table("industry_sector_mapping", tables.industrySectorMappings());
		}

		@Override
		public List<MetricHead> heads() {
			return table("heads", tables.heads());
		}

		@Override
		public List<MetricHead> ratioHeads() {
			return table("ratio_heads", tables.ratioHeads());
		}

		@Override
		public List<Term> terms() {
			return table("terms", tables.terms());
		}

		@Override
		public List<ConsolidationType> consolidations() {
			return table("consolidations", tables.consolidations());
		}

		@Override
		public List<Unit> units() {
			return table("units", tables.units());
		}

		@Override
		public List<DissectionGroup> dissectionGroups() {
			return table("dissection_groups", tables.dissectionGroups());
		}

		@Override
		public String describe() {
			return "test tables";
		}
	}
}
