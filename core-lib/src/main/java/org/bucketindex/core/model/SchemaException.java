package org.bucketindex.core.model;

import java.io.IOException;

/**
 * Thrown when a stored schema cannot be read back as an id column followed by bucket columns.
 */
public class SchemaException extends IOException {
	public SchemaException(String message) {
		super(message);
	}

	public SchemaException(String message, Throwable cause) {
		super(message, cause);
	}
}
