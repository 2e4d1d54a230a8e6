package org.bucketindex.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The finalized, strictly sorted bucket sequence shared by the encoder and the query planner.
 *
 * <p>Instances are immutable. The last bucket is always {@link BucketType#MULTI} and catches every
 * token at or above the last boundary.</p>
 */
public final class BucketPlan {
	private final List<Bucket> buckets;

	public BucketPlan(List<Bucket> buckets) {
		if (buckets == null || buckets.isEmpty()) {
			throw new IllegalArgumentException("A bucket plan needs at least one bucket");
		}
		for (int i = 1; i < buckets.size(); i++) {
			if (buckets.get(i - 1).compareTo(buckets.get(i)) >= 0) {
				throw new IllegalArgumentException("Buckets are not strictly sorted at position " + i
						+ ": " + buckets.get(i - 1) + " then " + buckets.get(i));
			}
		}
		if (buckets.get(buckets.size() - 1).type() != BucketType.MULTI) {
			throw new IllegalArgumentException("The last bucket must be MULTI: " + buckets.get(buckets.size() - 1));
		}
		this.buckets = List.copyOf(buckets);
	}

	/**
	 * Rebuilds the plan from a stored schema: the id column followed by one column per bucket.
	 */
	public static BucketPlan fromColumnNames(List<String> columnNames) throws SchemaException {
		if (columnNames == null || columnNames.size() < 2) {
			throw new SchemaException("Expected an id column and at least one bucket column, got " + columnNames);
		}
		if (!ColumnNames.isIdColumn(columnNames.get(0))) {
			throw new SchemaException("First column must be '" + ColumnNames.ID_COLUMN + "', got '"
					+ columnNames.get(0) + "'");
		}

		List<Bucket> decoded = new ArrayList<>(columnNames.size() - 1);
		for (String name : columnNames.subList(1, columnNames.size())) {
			decoded.add(ColumnNames.decode(name));
		}

		try {
			return new BucketPlan(decoded);
		} catch (IllegalArgumentException e) {
			throw new SchemaException("Stored buckets do not form a valid plan: " + e.getMessage(), e);
		}
	}

	/**
	 * Index of the bucket that owns {@code token}.
	 *
	 * <p>Probes for an exact {@code (token, SINGLE)} match; otherwise takes the bucket just before the
	 * insertion point, clamped to bucket 0 for tokens below every key. Query planning uses the same
	 * rule over column names.</p>
	 */
	public int resolve(String token) {
		int idx = Collections.binarySearch(buckets, Bucket.single(token));
		if (idx >= 0) {
			return idx;
		}
		int insertionPoint = -idx - 1;
		return insertionPoint == 0 ? 0 : insertionPoint - 1;
	}

	public Bucket bucket(int index) {
		return buckets.get(index);
	}

	public List<Bucket> buckets() {
		return buckets;
	}

	public int size() {
		return buckets.size();
	}

	public int countOf(BucketType type) {
		return (int) buckets.stream().filter(b -> b.type() == type).count();
	}

	/**
	 * Stored schema for this plan: the id column, then one column per bucket in plan order.
	 */
	public List<String> columnNames() {
		List<String> names = new ArrayList<>(buckets.size() + 1);
		names.add(ColumnNames.ID_COLUMN);
		for (Bucket bucket : buckets) {
			names.add(bucket.columnName());
		}
		return Collections.unmodifiableList(names);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof BucketPlan other)) return false;
		return buckets.equals(other.buckets);
	}

	@Override
	public int hashCode() {
		return buckets.hashCode();
	}

	@Override
	public String toString() {
		return "BucketPlan" + buckets;
	}
}
