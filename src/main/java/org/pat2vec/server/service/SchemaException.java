package org.pat2vec.server.service;

public class SchemaException extends IllegalArgumentException {

	private final String column;

	public SchemaException(String column, String message) {
		super(message);
		this.column = column;
	}

	public String getColumn() {
		return column;
	}
}
