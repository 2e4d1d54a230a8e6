package org.bucketindex.core.store;

/**
 * What a scan reports for matching rows.
 */
public enum Projection {
	/** Only the number of matching rows per batch. */
	COUNT,
	/** The ids of matching rows, in stored order. */
	IDS
}
