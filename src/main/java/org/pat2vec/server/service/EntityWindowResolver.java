package org.pat2vec.server.service;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.pat2vec.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static java.lang.String.format;

/**
 * Decides which window each entity is processed over.
 * <p>
 * Without per-entity windows every entity shares one global sequence, generated once per settings snapshot.
 * With them, an entity that has an override is windowed over it; an entity without one (a control) either
 * gets the global bounds or borrows the override of another entity, depending on the controls method.
 * Problems confined to one entity never throw: they produce a skipped result and a warning.
 */
@Service
public class EntityWindowResolver {

	static final int MAX_CACHED_SEQUENCES = 16;

	private final WindowSequenceGenerator generator;

	private final WindowingContext defaultContext;

	private final LoadingCache<WindowingContext, WindowSequence> globalSequences;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public EntityWindowResolver(WindowSequenceGenerator generator, WindowingContext windowingContext) {
		this.generator = generator;
		this.defaultContext = windowingContext;
		this.globalSequences = CacheBuilder.newBuilder()
				.maximumSize(MAX_CACHED_SEQUENCES)
				.build(CacheLoader.from(context -> generator.generate(context.getEffectiveAnchor(), context.getGlobalBounds(), context)));
	}

	public EntityWindows resolve(String entityId) {
		return resolve(entityId, Collections.emptyMap(), defaultContext);
	}

	public EntityWindows resolve(String entityId, Map<String, EntityWindowSpec> overrides) {
		return resolve(entityId, overrides, defaultContext);
	}

	public EntityWindows resolve(String entityId, Map<String, EntityWindowSpec> overrides, WindowingContext context) {
		Preconditions.checkNotNull(entityId, "entityId");
		Preconditions.checkNotNull(overrides, "overrides");
		Preconditions.checkNotNull(context, "context");

		if (!context.isIndividualPatientWindow()) {
			return EntityWindows.resolved(entityId, getGlobalSequence(context), context.getGlobalBounds(), WindowSource.GLOBAL);
		}

		EntityWindowSpec spec = overrides.get(entityId);
		WindowSource source = WindowSource.OVERRIDE;
		if (spec == null) {
			Optional<ControlsMethod> method = ControlsMethod.fromConfig(context.getControlsMethod());
			if (method.isEmpty()) {
				return skip(entityId, format("Unknown individual patient window controls method '%s'", context.getControlsMethod()));
			}
			if (method.get() == ControlsMethod.FULL) {
				GlobalBounds bounds = context.getGlobalBounds();
				spec = EntityWindowSpec.of(entityId, bounds.getEarliest(), bounds.getLatest());
				source = WindowSource.CONTROL_FULL;
			} else {
				if (overrides.isEmpty()) {
					return skip(entityId, "No entity window overrides available to borrow from");
				}
				EntityWindowSpec donor = pickDonor(entityId, overrides, context.getRandomSeed());
				logger.debug("Control {} borrows window {} from {}", entityId, donor.toBounds(), donor.getEntityId());
				spec = donor.borrowedBy(entityId);
				source = WindowSource.CONTROL_RANDOM;
			}
		}

		GlobalBounds bounds = spec.toBounds();
		WindowSequence sequence;
		try {
			sequence = generator.generate(spec.getAnchor(context.isLookback()), bounds, context);
		} catch (InvalidIntervalException e) {
			throw e;
		} catch (DateTimeException | IllegalArgumentException e) {
			return skip(entityId, format("Window %s cannot be resolved: %s", bounds, e.getMessage()));
		}
		if (sequence.isEmpty()) {
			logger.info("Entity {} has no slices inside {}", entityId, bounds);
		}
		return EntityWindows.resolved(entityId, sequence, bounds, source);
	}

	public WindowSequence getGlobalSequence(WindowingContext context) {
		try {
			return globalSequences.getUnchecked(context);
		} catch (UncheckedExecutionException e) {
			Throwables.throwIfUnchecked(e.getCause());
			throw e;
		}
	}

	long cachedSequenceCount() {
		return globalSequences.size();
	}

	EntityWindowSpec pickDonor(String entityId, Map<String, EntityWindowSpec> overrides, long seed) {
		ImmutableList<String> donorIds = Ordering.natural().immutableSortedCopy(overrides.keySet());
		long entitySeed = Hashing.murmur3_128().newHasher()
				.putLong(seed)
				.putString(entityId, StandardCharsets.UTF_8)
				.hash()
				.asLong();
		String donorId = donorIds.get(new Random(entitySeed).nextInt(donorIds.size()));
		return overrides.get(donorId);
	}

	private EntityWindows skip(String entityId, String reason) {
		logger.warn("Skipping entity {}: {}", entityId, reason);
		return EntityWindows.skipped(entityId, reason);
	}
}
