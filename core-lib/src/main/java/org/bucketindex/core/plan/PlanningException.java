package org.bucketindex.core.plan;

/**
 * Thrown when no usable bucket plan can be derived: an empty sample or a non-positive bucket count.
 * Index construction must stop before any batch is written.
 */
public class PlanningException extends IllegalArgumentException {
	public PlanningException(String message) {
		super(message);
	}
}
