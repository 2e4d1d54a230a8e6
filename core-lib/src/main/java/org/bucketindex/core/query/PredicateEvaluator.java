package org.bucketindex.core.query;

import org.bucketindex.core.model.Batch;
import org.bucketindex.core.model.BatchColumn;

import java.util.Arrays;

/**
 * Evaluates a {@link Predicate} over a whole {@link Batch} at once, producing one match flag per
 * row. Reads only the columns the predicate names, so a projected batch is enough.
 */
public final class PredicateEvaluator implements Predicate.Visitor<boolean[]> {
	private final Batch batch;

	private PredicateEvaluator(Batch batch) {
		this.batch = batch;
	}

	/**
	 * @throws IllegalStateException if a referenced column is missing or has the wrong shape
	 */
	public static boolean[] evaluate(Predicate predicate, Batch batch) {
		return predicate.accept(new PredicateEvaluator(batch));
	}

	public static int count(boolean[] mask) {
		int matched = 0;
		for (boolean m : mask) {
			if (m) matched++;
		}
		return matched;
	}

	@Override
	public boolean[] visitColumnEquals(Predicate.ColumnEquals predicate) {
		BatchColumn column = column(predicate.column());
		if (!(column instanceof BatchColumn.FlagColumn flags)) {
			throw new IllegalStateException("Column " + predicate.column() + " is not a flag column");
		}
		boolean[] mask = new boolean[batch.rowCount()];
		for (int row = 0; row < mask.length; row++) {
			mask[row] = flags.get(row) == predicate.value();
		}
		return mask;
	}

	@Override
	public boolean[] visitListContains(Predicate.ListContains predicate) {
		BatchColumn column = column(predicate.column());
		if (!(column instanceof BatchColumn.TokenListColumn lists)) {
			throw new IllegalStateException("Column " + predicate.column() + " is not a token list column");
		}
		boolean[] mask = new boolean[batch.rowCount()];
		for (int row = 0; row < mask.length; row++) {
			mask[row] = lists.get(row).contains(predicate.token());
		}
		return mask;
	}

	@Override
	public boolean[] visitAnd(Predicate.And predicate) {
		boolean[] left = predicate.left().accept(this);
		boolean[] right = predicate.right().accept(this);
		for (int row = 0; row < left.length; row++) {
			left[row] &= right[row];
		}
		return left;
	}

	@Override
	public boolean[] visitLiteral(Predicate.Literal predicate) {
		boolean[] mask = new boolean[batch.rowCount()];
		Arrays.fill(mask, predicate.value());
		return mask;
	}

	private BatchColumn column(String name) {
		if (!batch.hasColumn(name)) {
			throw new IllegalStateException("Batch has no column " + name);
		}
		return batch.column(name);
	}
}
