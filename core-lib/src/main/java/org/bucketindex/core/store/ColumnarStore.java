package org.bucketindex.core.store;

import org.bucketindex.core.model.Batch;
import org.bucketindex.core.query.Predicate;

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;

/**
 * Persists the batches of one index under a single schema and scans them with a pushed-down
 * predicate.
 */
public interface ColumnarStore extends Closeable {

	/**
	 * Write every batch pulled from {@code batches}. Batches are self-contained: if pulling or
	 * writing a batch fails, the batches already written stay readable.
	 *
	 * @param columnNames schema shared by all batches, id column first
	 */
	void write(List<String> columnNames, Iterator<Batch> batches) throws IOException;

	/**
	 * Column names in the order they were written.
	 *
	 * @throws org.bucketindex.core.model.SchemaException if nothing readable has been written
	 */
	List<String> columnNames() throws IOException;

	/**
	 * Evaluate {@code filter} over the stored batches.
	 *
	 * <p>A store may drop rows that cannot match before they are evaluated and regroup the
	 * survivors, so the entries need not line up with the written batches.</p>
	 *
	 * @return one entry per evaluated batch, in stored order
	 * @throws org.bucketindex.core.query.QueryEvaluationException if reading or evaluating fails
	 */
	List<BatchMatch> scan(Predicate filter, Projection projection) throws IOException;

	/**
	 * Sum of matching rows over all batches.
	 */
	default long count(Predicate filter) throws IOException {
		long total = 0;
		for (BatchMatch match : scan(filter, Projection.COUNT)) {
			total += match.matched();
		}
		return total;
	}

	/**
	 * Total number of stored documents.
	 */
	long rowCount() throws IOException;
}
