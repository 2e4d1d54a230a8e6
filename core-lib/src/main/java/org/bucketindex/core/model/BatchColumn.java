package org.bucketindex.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One finalized bucket column of a {@link Batch}.
 */
public sealed interface BatchColumn permits BatchColumn.FlagColumn, BatchColumn.TokenListColumn {

	String name();

	int size();

	/** Presence flags of a {@link BucketType#SINGLE} bucket. */
	record FlagColumn(String name, boolean[] values) implements BatchColumn {
		public FlagColumn {
			Objects.requireNonNull(name, "name");
			Objects.requireNonNull(values, "values");
		}

		public boolean get(int row) {
			return values[row];
		}

		@Override
		public int size() {
			return values.length;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (!(o instanceof FlagColumn other)) return false;
			return name.equals(other.name) && Arrays.equals(values, other.values);
		}

		@Override
		public int hashCode() {
			return 31 * name.hashCode() + Arrays.hashCode(values);
		}

		@Override
		public String toString() {
			return "FlagColumn{" + name + ", rows=" + values.length + "}";
		}
	}

	/** Per-document token lists of a {@link BucketType#MULTI} bucket. */
	record TokenListColumn(String name, List<List<String>> values) implements BatchColumn {
		public TokenListColumn {
			Objects.requireNonNull(name, "name");
			values = List.copyOf(values);
		}

		public List<String> get(int row) {
			return values.get(row);
		}

		@Override
		public int size() {
			return values.size();
		}

		@Override
		public String toString() {
			return "TokenListColumn{" + name + ", rows=" + values.size() + "}";
		}
	}
}
