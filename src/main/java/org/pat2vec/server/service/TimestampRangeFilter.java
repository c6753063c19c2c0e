package org.pat2vec.server.service;

import com.google.common.base.Preconditions;
import org.pat2vec.model.CalendarDate;
import org.pat2vec.model.RecordTable;
import org.pat2vec.model.TimeWindow;
import org.pat2vec.model.WindowingContext;
import org.pat2vec.server.service.InvalidDateException.Boundary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;

@Service
public class TimestampRangeFilter {

	private final WindowingContext defaultContext;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public TimestampRangeFilter(WindowingContext windowingContext) {
		this.defaultContext = windowingContext;
	}

	public RecordTable filter(RecordTable table, TimeWindow window, String timestampColumn) {
		return filter(table, window, timestampColumn, defaultContext);
	}

	public RecordTable filter(RecordTable table, TimeWindow window, String timestampColumn, WindowingContext context) {
		Preconditions.checkNotNull(context, "context");
		return filter(table, window, timestampColumn, context.isDropnaTimestamps());
	}

	public RecordTable filter(RecordTable table, Object startYear, Object startMonth, Object endYear, Object endMonth,
			Object startDay, Object endDay, String timestampColumn, boolean dropna) {
		CalendarDate start = DateValidator.toCalendarDate(Boundary.START, startYear, startMonth, startDay);
		CalendarDate end = DateValidator.toCalendarDate(Boundary.END, endYear, endMonth, endDay);
		return filter(table, TimeWindow.of(start, end), timestampColumn, dropna);
	}

	/**
	 * Returns a new table holding the rows whose timestamp, normalised to UTC, lies inside the window.
	 * The timestamp cells of the returned rows hold the normalised values. Rows whose timestamp is missing
	 * or unreadable never match; with {@code dropna} they are discarded before filtering.
	 *
	 * @throws SchemaException when the table has no such timestamp column
	 */
	public RecordTable filter(RecordTable table, TimeWindow window, String timestampColumn, boolean dropna) {
		Preconditions.checkNotNull(table, "table");
		Preconditions.checkNotNull(window, "window");
		if (!table.hasColumn(timestampColumn)) {
			throw new SchemaException(timestampColumn, format("Timestamp column '%s' not found in %s", timestampColumn, table.getColumns()));
		}

		List<Map<String, Object>> parsedRows = new ArrayList<>(table.size());
		int missing = 0;
		for (Map<String, Object> row : table.getRows()) {
			Optional<OffsetDateTime> timestamp = TimestampParser.parse(row.get(timestampColumn));
			if (timestamp.isEmpty()) {
				missing++;
				if (dropna) {
					continue;
				}
			}
			Map<String, Object> copy = new LinkedHashMap<>(row);
			copy.put(timestampColumn, timestamp.orElse(null));
			parsedRows.add(copy);
		}
		if (missing > 0) {
			logger.debug("{} of {} rows have no readable '{}'{}", missing, table.size(), timestampColumn, dropna ? ", dropped" : "");
		}

		List<Map<String, Object>> matching = new ArrayList<>();
		for (Map<String, Object> row : parsedRows) {
			OffsetDateTime timestamp = (OffsetDateTime) row.get(timestampColumn);
			if (timestamp != null && window.contains(timestamp)) {
				matching.add(row);
			}
		}
		return table.withRows(matching);
	}
}
