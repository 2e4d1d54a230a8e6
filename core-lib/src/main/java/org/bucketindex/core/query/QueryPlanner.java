package org.bucketindex.core.query;

import org.bucketindex.core.model.BucketPlan;
import org.bucketindex.core.model.BucketType;
import org.bucketindex.core.model.ColumnNames;
import org.bucketindex.core.model.SchemaException;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a set of query tokens into a conjunctive {@link Predicate} over the columns of a stored
 * index.
 *
 * <p>Works on column names alone: the encoding in {@link ColumnNames} preserves bucket order, so a
 * binary search over the bucket column names picks the same bucket as {@link BucketPlan#resolve}
 * did at index time.</p>
 */
public final class QueryPlanner {
	private final BucketPlan plan;
	private final List<String> schemaNames;
	private final List<String> bucketColumns;

	/**
	 * @param schemaNames stored column names in written order: the id column, then the buckets
	 * @throws SchemaException if the names do not describe an id column followed by a valid plan
	 */
	public QueryPlanner(List<String> schemaNames) throws SchemaException {
		this.plan = BucketPlan.fromColumnNames(schemaNames);
		this.schemaNames = List.copyOf(schemaNames);
		this.bucketColumns = this.schemaNames.subList(1, this.schemaNames.size());
	}

	public static Predicate plan(Set<String> queryTokens, List<String> schemaNames) throws SchemaException {
		return new QueryPlanner(schemaNames).plan(queryTokens);
	}

	/**
	 * AND of one term per token. An empty token set yields {@link Predicate#FALSE}, which matches
	 * nothing; callers wanting "match all" must handle that case themselves.
	 */
	public Predicate plan(Set<String> queryTokens) {
		Predicate result = null;
		for (String token : new TreeSet<>(queryTokens)) {
			Predicate term = termFor(token);
			result = result == null ? term : result.and(term);
		}
		return result == null ? Predicate.FALSE : result;
	}

	/**
	 * Position in the stored schema (id column = 0) of the column that holds {@code token}.
	 */
	public int resolveColumn(String token) {
		String needle = ColumnNames.encode(token, BucketType.SINGLE);
		int idx = Collections.binarySearch(bucketColumns, needle);
		if (idx >= 0) {
			return idx + 1;
		}
		int insertionPoint = -idx - 1;
		return insertionPoint == 0 ? 1 : insertionPoint;
	}

	private Predicate termFor(String token) {
		int column = resolveColumn(token);
		String name = schemaNames.get(column);
		if (name.equals(ColumnNames.encode(token, BucketType.SINGLE))) {
			return new Predicate.ColumnEquals(name, true);
		}
		return new Predicate.ListContains(name, token);
	}

	/**
	 * The bucket plan recovered from the schema.
	 */
	public BucketPlan bucketPlan() {
		return plan;
	}

	public List<String> schemaNames() {
		return schemaNames;
	}
}
