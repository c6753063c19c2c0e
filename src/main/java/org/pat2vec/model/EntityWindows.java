package org.pat2vec.model;

import com.google.common.base.Preconditions;

import java.util.Optional;

public final class EntityWindows {

	private final String entityId;
	private final WindowSequence sequence;
	private final GlobalBounds bounds;
	private final WindowSource source;
	private final String skipReason;

	private EntityWindows(String entityId, WindowSequence sequence, GlobalBounds bounds, WindowSource source, String skipReason) {
		this.entityId = entityId;
		this.sequence = sequence;
		this.bounds = bounds;
		this.source = source;
		this.skipReason = skipReason;
	}

	public static EntityWindows resolved(String entityId, WindowSequence sequence, GlobalBounds bounds, WindowSource source) {
		Preconditions.checkNotNull(sequence, "sequence");
		Preconditions.checkNotNull(bounds, "bounds");
		Preconditions.checkNotNull(source, "source");
		return new EntityWindows(entityId, sequence, bounds, source, null);
	}

	public static EntityWindows skipped(String entityId, String reason) {
		Preconditions.checkNotNull(reason, "reason");
		return new EntityWindows(entityId, null, null, null, reason);
	}

	public String getEntityId() {
		return entityId;
	}

	public boolean isSkipped() {
		return skipReason != null;
	}

	public Optional<WindowSequence> getSequence() {
		return Optional.ofNullable(sequence);
	}

	public Optional<GlobalBounds> getBounds() {
		return Optional.ofNullable(bounds);
	}

	public Optional<WindowSource> getSource() {
		return Optional.ofNullable(source);
	}

	public Optional<String> getSkipReason() {
		return Optional.ofNullable(skipReason);
	}

	@Override
	public String toString() {
		if (isSkipped()) {
			return "EntityWindows{" + entityId + " skipped: " + skipReason + "}";
		}
		return "EntityWindows{" + entityId + " " + source + " " + bounds + " slices=" + sequence.size() + "}";
	}
}
