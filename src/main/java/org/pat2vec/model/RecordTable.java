package org.pat2vec.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.*;

public final class RecordTable {

	private final ImmutableList<String> columns;
	private final ImmutableList<Map<String, Object>> rows;

	private RecordTable(ImmutableList<String> columns, ImmutableList<Map<String, Object>> rows) {
		this.columns = columns;
		this.rows = rows;
	}

	public static RecordTable of(List<String> columns, List<? extends Map<String, ?>> rows) {
		Preconditions.checkNotNull(columns, "columns");
		Preconditions.checkNotNull(rows, "rows");
		ImmutableList<String> columnList = ImmutableList.copyOf(new LinkedHashSet<>(columns));
		ImmutableList.Builder<Map<String, Object>> copies = ImmutableList.builder();
		for (Map<String, ?> row : rows) {
			Map<String, Object> copy = new LinkedHashMap<>();
			for (String column : columnList) {
				copy.put(column, row.get(column));
			}
			copies.add(Collections.unmodifiableMap(copy));
		}
		return new RecordTable(columnList, copies.build());
	}

	public static RecordTable fromRows(List<? extends Map<String, ?>> rows) {
		Set<String> columns = new LinkedHashSet<>();
		rows.forEach(row -> columns.addAll(row.keySet()));
		return of(new ArrayList<>(columns), rows);
	}

	public static RecordTable empty(List<String> columns) {
		return of(columns, Collections.emptyList());
	}

	public List<String> getColumns() {
		return columns;
	}

	public boolean hasColumn(String column) {
		return columns.contains(column);
	}

	public List<Map<String, Object>> getRows() {
		return rows;
	}

	public int size() {
		return rows.size();
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}

	public RecordTable withRows(List<? extends Map<String, ?>> newRows) {
		return of(columns, newRows);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		RecordTable that = (RecordTable) o;
		return columns.equals(that.columns) && rows.equals(that.rows);
	}

	@Override
	public int hashCode() {
		return 31 * columns.hashCode() + rows.hashCode();
	}

	@Override
	public String toString() {
		return "RecordTable{columns=" + columns + ", rows=" + rows.size() + "}";
	}
}
