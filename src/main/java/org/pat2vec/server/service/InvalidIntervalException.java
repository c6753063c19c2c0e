package org.pat2vec.server.service;

public class InvalidIntervalException extends IllegalArgumentException {

	public InvalidIntervalException(String message) {
		super(message);
	}
}
