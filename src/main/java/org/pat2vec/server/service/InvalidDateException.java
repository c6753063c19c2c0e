package org.pat2vec.server.service;

import java.util.Locale;

public class InvalidDateException extends IllegalArgumentException {

	public enum Boundary {
		START,
		END;

		String label() {
			return name().toLowerCase(Locale.ROOT);
		}
	}

	private final Boundary boundary;

	public InvalidDateException(Boundary boundary, String message) {
		super(message);
		this.boundary = boundary;
	}

	public InvalidDateException(Boundary boundary, String message, Throwable cause) {
		super(message, cause);
		this.boundary = boundary;
	}

	public Boundary getBoundary() {
		return boundary;
	}
}
