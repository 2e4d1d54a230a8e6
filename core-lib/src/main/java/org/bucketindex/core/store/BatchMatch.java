package org.bucketindex.core.store;

import java.util.Arrays;

/**
 * Outcome of evaluating one batch.
 *
 * @param rows rows that reached evaluation; fewer than the store holds when it filtered rows first
 * @param matched rows satisfying the predicate
 * @param ids ids of the matching rows; empty unless {@link Projection#IDS} was requested
 */
public record BatchMatch(int rows, int matched, long[] ids) {
	private static final long[] NO_IDS = new long[0];

	public static BatchMatch counted(int rows, int matched) {
		return new BatchMatch(rows, matched, NO_IDS);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof BatchMatch other)) return false;
		return rows == other.rows && matched == other.matched && Arrays.equals(ids, other.ids);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * rows + matched) + Arrays.hashCode(ids);
	}

	@Override
	public String toString() {
		return "BatchMatch{rows=" + rows + ", matched=" + matched + ", ids=" + ids.length + "}";
	}
}
