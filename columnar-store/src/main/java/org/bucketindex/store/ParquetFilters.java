package org.bucketindex.store;

import org.apache.parquet.filter2.compat.FilterCompat;
import org.apache.parquet.filter2.predicate.FilterApi;
import org.apache.parquet.filter2.predicate.FilterPredicate;
import org.bucketindex.core.query.Predicate;

import java.util.Optional;

/**
 * Translates the pushable part of a {@link Predicate} into a Parquet record filter.
 *
 * <p>Only flag comparisons have a Parquet equivalent. List membership is left out of the pushdown
 * and re-checked on the decoded batches, so the pushed filter may match a superset of rows but
 * never drops a matching one.</p>
 */
final class ParquetFilters implements Predicate.Visitor<Optional<FilterPredicate>> {
	private static final ParquetFilters INSTANCE = new ParquetFilters();

	private ParquetFilters() {}

	static FilterCompat.Filter toFilter(Predicate predicate) {
		return predicate.accept(INSTANCE)
				.map(pushed -> FilterCompat.get(pushed))
				.orElse(FilterCompat.NOOP);
	}

	@Override
	public Optional<FilterPredicate> visitColumnEquals(Predicate.ColumnEquals predicate) {
		return Optional.of(FilterApi.eq(FilterApi.booleanColumn(predicate.column()), predicate.value()));
	}

	@Override
	public Optional<FilterPredicate> visitListContains(Predicate.ListContains predicate) {
		return Optional.empty();
	}

	@Override
	public Optional<FilterPredicate> visitAnd(Predicate.And predicate) {
		Optional<FilterPredicate> left = predicate.left().accept(this);
		Optional<FilterPredicate> right = predicate.right().accept(this);
		if (left.isPresent() && right.isPresent()) {
			return Optional.of(FilterApi.and(left.get(), right.get()));
		}
		return left.isPresent() ? left : right;
	}

	@Override
	public Optional<FilterPredicate> visitLiteral(Predicate.Literal predicate) {
		return Optional.empty();
	}
}
