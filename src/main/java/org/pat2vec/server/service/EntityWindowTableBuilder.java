package org.pat2vec.server.service;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import org.pat2vec.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;

@Service
public class EntityWindowTableBuilder {

	public static final String OFFSET_SUFFIX = "_offset";

	private final WindowingContext defaultContext;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public EntityWindowTableBuilder(WindowingContext windowingContext) {
		this.defaultContext = windowingContext;
	}

	public Map<String, EntityWindowSpec> build(RecordTable table, String entityIdColumn, String anchorColumn) {
		return build(table, entityIdColumn, anchorColumn, defaultContext);
	}

	/**
	 * Each usable row becomes a window between its anchor and the anchor shifted by the configured span,
	 * backwards when looking back. A column named after the anchor column with the {@value #OFFSET_SUFFIX}
	 * suffix, when present, supplies the other end directly. Rows with a blank id or an unreadable date are left out.
	 * A later row for the same entity replaces an earlier one.
	 *
	 * @throws SchemaException when the id or anchor column is missing
	 */
	public Map<String, EntityWindowSpec> build(RecordTable table, String entityIdColumn, String anchorColumn, WindowingContext context) {
		Preconditions.checkNotNull(table, "table");
		Preconditions.checkNotNull(context, "context");
		requireColumn(table, entityIdColumn);
		requireColumn(table, anchorColumn);

		String offsetColumn = anchorColumn + OFFSET_SUFFIX;
		boolean precomputedOffsets = table.hasColumn(offsetColumn);
		if (precomputedOffsets) {
			logger.info("Using existing offset column '{}', delete it from the table to recompute offsets", offsetColumn);
		}
		RelativeDuration offset = context.isLookback() ? context.getSpan().negated() : context.getSpan();

		Map<String, EntityWindowSpec> overrides = new LinkedHashMap<>();
		int dropped = 0;
		for (Map<String, Object> row : table.getRows()) {
			Object rawId = row.get(entityIdColumn);
			String entityId = rawId == null ? null : rawId.toString().trim();
			Optional<CalendarDate> anchor = TimestampParser.parseDate(row.get(anchorColumn));
			if (Strings.isNullOrEmpty(entityId) || anchor.isEmpty()) {
				dropped++;
				continue;
			}
			Optional<CalendarDate> otherEnd;
			try {
				otherEnd = precomputedOffsets
						? TimestampParser.parseDate(row.get(offsetColumn))
						: Optional.of(anchor.get().plus(offset));
			} catch (IllegalArgumentException | DateTimeException e) {
				otherEnd = Optional.empty();
			}
			if (otherEnd.isEmpty()) {
				dropped++;
				continue;
			}
			overrides.put(entityId, EntityWindowSpec.of(entityId, anchor.get(), otherEnd.get()));
		}
		if (dropped > 0) {
			logger.warn("Dropped {} of {} rows without a usable entity id or window date", dropped, table.size());
		}
		logger.info("Built {} entity window overrides", overrides.size());
		return Collections.unmodifiableMap(overrides);
	}

	private static void requireColumn(RecordTable table, String column) {
		if (!table.hasColumn(column)) {
			throw new SchemaException(column, format("Column '%s' not found in %s", column, table.getColumns()));
		}
	}
}
