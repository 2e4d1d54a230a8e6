package org.bucketindex.core.encode;

import org.bucketindex.core.model.BatchColumn;
import org.bucketindex.core.model.BucketType;

import java.util.List;

/**
 * Accumulates one bucket column for the chunk being encoded. Owned by a single encoder and
 * discarded once {@link #finish()} hands out the immutable column.
 */
interface ColumnBuilder {

	/**
	 * Append one document's row.
	 *
	 * @param tokens the document's tokens that resolved to this bucket, possibly empty
	 */
	void append(List<String> tokens);

	BatchColumn finish();

	static ColumnBuilder forType(String name, BucketType type, int capacity) {
		return switch (type) {
			case SINGLE -> new FlagColumnBuilder(name, capacity);
			case MULTI -> new TokenListColumnBuilder(name, capacity);
		};
	}
}
