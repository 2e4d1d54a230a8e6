package org.bucketindex.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable chunk of encoded documents: the id column plus a set of bucket columns.
 *
 * <p>Batches written by the encoder carry every bucket column of the plan. Batches read back from a
 * store may carry only the projected columns.</p>
 */
public final class Batch {
	private final long[] ids;
	private final Map<String, BatchColumn> columns;

	public Batch(long[] ids, List<BatchColumn> columns) {
		this.ids = ids.clone();
		Map<String, BatchColumn> byName = new LinkedHashMap<>();
		for (BatchColumn column : columns) {
			if (column.size() != ids.length) {
				throw new IllegalArgumentException("Column " + column.name() + " has " + column.size()
						+ " rows, expected " + ids.length);
			}
			if (byName.put(column.name(), column) != null) {
				throw new IllegalArgumentException("Duplicate column " + column.name());
			}
		}
		this.columns = Collections.unmodifiableMap(byName);
	}

	public int rowCount() {
		return ids.length;
	}

	public long id(int row) {
		return ids[row];
	}

	public long[] ids() {
		return ids.clone();
	}

	public boolean hasColumn(String name) {
		return columns.containsKey(name);
	}

	public BatchColumn column(String name) {
		BatchColumn column = columns.get(name);
		if (column == null) {
			throw new IllegalArgumentException("Batch has no column " + name);
		}
		return column;
	}

	public List<BatchColumn> columns() {
		return List.copyOf(columns.values());
	}

	/**
	 * Column names in stored order, starting with the id column.
	 */
	public List<String> columnNames() {
		List<String> names = new ArrayList<>(columns.size() + 1);
		names.add(ColumnNames.ID_COLUMN);
		names.addAll(columns.keySet());
		return names;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Batch other)) return false;
		return Arrays.equals(ids, other.ids) && columns.equals(other.columns);
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(ids) + columns.hashCode();
	}

	@Override
	public String toString() {
		return "Batch{rows=" + ids.length + ", columns=" + columns.size() + "}";
	}
}
