package org.bucketindex.core.encode;

import org.bucketindex.core.model.BatchColumn;

import java.util.ArrayList;
import java.util.List;

/** Keeps the tokens each document contributed to the bucket, in traversal order. */
final class TokenListColumnBuilder implements ColumnBuilder {
	private final String name;
	private final List<List<String>> values;

	TokenListColumnBuilder(String name, int capacity) {
		this.name = name;
		this.values = new ArrayList<>(capacity);
	}

	@Override
	public void append(List<String> tokens) {
		values.add(List.copyOf(tokens));
	}

	@Override
	public BatchColumn finish() {
		return new BatchColumn.TokenListColumn(name, values);
	}
}
