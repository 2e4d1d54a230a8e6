package org.bucketindex.core.store;

import org.bucketindex.core.model.Batch;
import org.bucketindex.core.query.Predicate;
import org.bucketindex.core.query.PredicateEvaluator;

/**
 * Shared per-batch evaluation used by store implementations.
 */
public final class BatchScanner {
	private BatchScanner() {}

	public static BatchMatch match(Batch batch, Predicate filter, Projection projection) {
		boolean[] mask = PredicateEvaluator.evaluate(filter, batch);
		int matched = PredicateEvaluator.count(mask);
		if (projection != Projection.IDS) {
			return BatchMatch.counted(batch.rowCount(), matched);
		}

		long[] ids = new long[matched];
		int next = 0;
		for (int row = 0; row < mask.length; row++) {
			if (mask[row]) {
				ids[next++] = batch.id(row);
			}
		}
		return new BatchMatch(batch.rowCount(), matched, ids);
	}
}
