package my.finresolver.app.query;

import my.finresolver.app.domain.DataAxis;
import my.finresolver.app.domain.MetricKind;
import my.finresolver.app.domain.PeriodBasis;

/**
 * Warehouse data tables. Every table shares the key columns; dissection tables add the group id.
 */
public enum DataTable {
	FINANCIAL_DATA("financial_data", PeriodBasis.STANDARD, false),
	FINANCIAL_DATA_QUARTER("financial_data_quarter", PeriodBasis.QUARTERLY, false),
	FINANCIAL_DATA_TTM("financial_data_ttm", PeriodBasis.TTM, false),
	RATIO_DATA("ratio_data", PeriodBasis.STANDARD, false),
	DISSECTION_DATA("dissection_data", PeriodBasis.STANDARD, true),
	DISSECTION_DATA_QUARTER("dissection_data_quarter", PeriodBasis.QUARTERLY, true),
	DISSECTION_DATA_TTM("dissection_data_ttm", PeriodBasis.TTM, true),
	DISSECTION_DATA_RATIO("dissection_data_ratio", PeriodBasis.STANDARD, true);

	private final String tableName;
	private final PeriodBasis basis;
	private final boolean dissection;

	DataTable(String tableName, PeriodBasis basis, boolean dissection) {
		this.tableName = tableName;
		this.basis = basis;
		this.dissection = dissection;
	}

	public String tableName() {
		return tableName;
	}

	public PeriodBasis basis() {
		return basis;
	}

	public boolean isDissection() {
		return dissection;
	}

	public static DataTable select(MetricKind kind, DataAxis axis) {
		return switch (kind.type()) {
			case REGULAR -> switch (axis) {
				case QUARTERLY -> FINANCIAL_DATA_QUARTER;
				case TTM -> FINANCIAL_DATA_TTM;
				case REGULAR, RATIO -> FINANCIAL_DATA;
			};
			case RATIO -> RATIO_DATA;
			case DISSECTION -> switch (axis) {
				case REGULAR -> DISSECTION_DATA;
				case QUARTERLY -> DISSECTION_DATA_QUARTER;
				case TTM -> DISSECTION_DATA_TTM;
				case RATIO -> DISSECTION_DATA_RATIO;
			};
		};
	}

	/**
	 * Axis a metric of the given kind is read from. A TTM or quarterly period forces the axis; otherwise
	 * dissections use the group's own axis.
	 */
	public static DataAxis axisFor(MetricKind kind, PeriodBasis basis, DataAxis dissectionDefault) {
		return switch (kind.type()) {
			case REGULAR -> DataAxis.forBasis(basis);
			case RATIO -> DataAxis.RATIO;
			case DISSECTION -> {
				if (basis == PeriodBasis.TTM) {
					yield DataAxis.TTM;
				}
				if (basis == PeriodBasis.QUARTERLY) {
					yield DataAxis.QUARTERLY;
				}
				yield dissectionDefault == null ? DataAxis.REGULAR : dissectionDefault;
			}
		};
	}
}
