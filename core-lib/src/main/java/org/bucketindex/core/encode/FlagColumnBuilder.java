package org.bucketindex.core.encode;

import org.bucketindex.core.model.BatchColumn;

import java.util.Arrays;
import java.util.List;

/** Sets a document's flag when at least one of its tokens landed in the bucket. */
final class FlagColumnBuilder implements ColumnBuilder {
	private final String name;
	private boolean[] values;
	private int size;

	FlagColumnBuilder(String name, int capacity) {
		this.name = name;
		this.values = new boolean[Math.max(capacity, 16)];
	}

	@Override
	public void append(List<String> tokens) {
		if (size == values.length) {
			values = Arrays.copyOf(values, values.length * 2);
		}
		values[size++] = !tokens.isEmpty();
	}

	@Override
	public BatchColumn finish() {
		return new BatchColumn.FlagColumn(name, Arrays.copyOf(values, size));
	}
}
