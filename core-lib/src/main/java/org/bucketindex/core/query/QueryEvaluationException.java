package org.bucketindex.core.query;

import java.io.IOException;

/**
 * Thrown when a scan over stored batches fails, either reading them or evaluating the predicate.
 * Scans are not retried.
 */
public class QueryEvaluationException extends IOException {
	public QueryEvaluationException(String message) {
		super(message);
	}

	public QueryEvaluationException(String message, Throwable cause) {
		super(message, cause);
	}
}
