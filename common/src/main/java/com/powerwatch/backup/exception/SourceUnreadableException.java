package com.powerwatch.backup.exception;

import java.nio.file.Path;

/**
 * Thrown when an input file is missing, corrupt or in a format no reader understands.
 * A run that hits this for either source must stop before the join.
 */
public class SourceUnreadableException extends Exception {

	private static final long serialVersionUID = 4417018925113604120L;

	private final Path source;

	public SourceUnreadableException(Path source, String message) {
		super(message);
		this.source = source;
	}

	public SourceUnreadableException(Path source, String message, Throwable cause) {
		super(message, cause);
		this.source = source;
	}

	public Path getSource() {
		return source;
	}
}
