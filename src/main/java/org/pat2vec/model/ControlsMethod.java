package org.pat2vec.model;

import java.util.Locale;
import java.util.Optional;

public enum ControlsMethod {

	FULL,

	RANDOM;

	public static Optional<ControlsMethod> fromConfig(String value) {
		if (value == null) {
			return Optional.empty();
		}
		for (ControlsMethod method : values()) {
			if (method.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
				return Optional.of(method);
			}
		}
		return Optional.empty();
	}
}
