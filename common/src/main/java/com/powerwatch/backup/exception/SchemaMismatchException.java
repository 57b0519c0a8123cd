package com.powerwatch.backup.exception;

import java.util.List;

public class SchemaMismatchException extends Exception {

	private static final long serialVersionUID = -6019245572301794417L;

	private final String table;

	private final List<String> missingColumns;

	public SchemaMismatchException(String table, List<String> missingColumns) {
		super("Table '" + table + "' is missing required columns " + missingColumns);
		this.table = table;
		this.missingColumns = List.copyOf(missingColumns);
	}

	public String getTable() {
		return table;
	}

	public List<String> getMissingColumns() {
		return missingColumns;
	}
}
