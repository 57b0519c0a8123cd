package com.powerwatch.backup.exception;

/**
 * Raised once a replace of an entity kind has been rolled back. Whatever was committed
 * before the failed save is still in place when this is thrown.
 */
public class PersistenceFailureException extends RuntimeException {

	private static final long serialVersionUID = 7742365086519027133L;

	private final String table;

	public PersistenceFailureException(String table, String message, Throwable cause) {
		super(message, cause);
		this.table = table;
	}

	public String getTable() {
		return table;
	}
}
