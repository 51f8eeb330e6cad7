package my.finresolver.app.domain;

import java.util.Objects;

/**
 * Kind of a metric head: regular line item, ratio, or a dissection of a base head.
 * Only the dissection variant carries a group id.
 */
public final class MetricKind {
	public enum Type {
		REGULAR,
		RATIO,
		DISSECTION
	}

	private static final MetricKind REGULAR = new MetricKind(Type.REGULAR, null);
	private static final MetricKind RATIO = new MetricKind(Type.RATIO, null);

	private final Type type;
	private final Long dissectionGroupId;

	private MetricKind(Type type, Long dissectionGroupId) {
		this.type = type;
		this.dissectionGroupId = dissectionGroupId;
	}

	public static MetricKind regular() {
		return REGULAR;
	}

	public static MetricKind ratio() {
		return RATIO;
	}

	public static MetricKind dissection(long groupId) {
		return new MetricKind(Type.DISSECTION, groupId);
	}

	public Type type() {
		return type;
	}

	public boolean isDissection() {
		return type == Type.DISSECTION;
	}

	public long dissectionGroupId() {
		if (dissectionGroupId == null) {
			throw new IllegalStateException("Metric kind " + type + " has no dissection group");
		}
		return dissectionGroupId;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof MetricKind kind)) {
			return false;
		}
		return type == kind.type && Objects.equals(dissectionGroupId, kind.dissectionGroupId);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, dissectionGroupId);
	}

	@Override
	public String toString() {
		return dissectionGroupId == null ? type.name() : type.name() + "(" + dissectionGroupId + ")";
	}
}
