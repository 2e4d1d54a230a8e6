package org.bucketindex.core.encode;

/**
 * Thrown when a chunk cannot be encoded, e.g. a corrupted document or a column whose length does
 * not match the chunk. The in-flight chunk is discarded; batches already produced stay valid.
 */
public class EncodingException extends RuntimeException {
	public EncodingException(String message) {
		super(message);
	}

	public EncodingException(String message, Throwable cause) {
		super(message, cause);
	}
}
