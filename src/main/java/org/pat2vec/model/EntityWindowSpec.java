package org.pat2vec.model;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.io.Serializable;

public final class EntityWindowSpec implements Serializable {

	private final String entityId;
	private final CalendarDate startDate;
	private final CalendarDate endDate;

	private EntityWindowSpec(String entityId, CalendarDate startDate, CalendarDate endDate) {
		this.entityId = entityId;
		this.startDate = startDate;
		this.endDate = endDate;
	}

	public static EntityWindowSpec of(String entityId, CalendarDate first, CalendarDate second) {
		Preconditions.checkArgument(!Strings.isNullOrEmpty(entityId), "entityId must not be empty");
		GlobalBounds ordered = GlobalBounds.of(first, second);
		return new EntityWindowSpec(entityId, ordered.getEarliest(), ordered.getLatest());
	}

	public String getEntityId() {
		return entityId;
	}

	public CalendarDate getStartDate() {
		return startDate;
	}

	public CalendarDate getEndDate() {
		return endDate;
	}

	// End of the window when looking back, otherwise its start.
	public CalendarDate getAnchor(boolean lookback) {
		return lookback ? endDate : startDate;
	}

	public GlobalBounds toBounds() {
		return GlobalBounds.of(startDate, endDate);
	}

	public EntityWindowSpec borrowedBy(String borrowerId) {
		return of(borrowerId, startDate, endDate);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		EntityWindowSpec that = (EntityWindowSpec) o;
		return entityId.equals(that.entityId) && startDate.equals(that.startDate) && endDate.equals(that.endDate);
	}

	@Override
	public int hashCode() {
		int result = entityId.hashCode();
		result = 31 * result + startDate.hashCode();
		return 31 * result + endDate.hashCode();
	}

	@Override
	public String toString() {
		return entityId + "[" + startDate + ".." + endDate + "]";
	}
}
