package org.bucketindex.core.query;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Boolean filter over bucket columns. The variant set is closed; consumers dispatch through
 * {@link Visitor}.
 */
public sealed interface Predicate
		permits Predicate.ColumnEquals, Predicate.ListContains, Predicate.And, Predicate.Literal {

	Literal FALSE = new Literal(false);

	<R> R accept(Visitor<R> visitor);

	default Predicate and(Predicate other) {
		return new And(this, other);
	}

	/**
	 * Names of every column the predicate reads, in first-use order.
	 */
	default Set<String> columns() {
		Set<String> names = new LinkedHashSet<>();
		accept(new Visitor<Void>() {
			@Override
			public Void visitColumnEquals(ColumnEquals predicate) {
				names.add(predicate.column());
				return null;
			}

			@Override
			public Void visitListContains(ListContains predicate) {
				names.add(predicate.column());
				return null;
			}

			@Override
			public Void visitAnd(And predicate) {
				predicate.left().accept(this);
				predicate.right().accept(this);
				return null;
			}

			@Override
			public Void visitLiteral(Literal predicate) {
				return null;
			}
		});
		return names;
	}

	interface Visitor<R> {
		R visitColumnEquals(ColumnEquals predicate);

		R visitListContains(ListContains predicate);

		R visitAnd(And predicate);

		R visitLiteral(Literal predicate);
	}

	/** A flag column compared with a constant. */
	record ColumnEquals(String column, boolean value) implements Predicate {
		public ColumnEquals {
			Objects.requireNonNull(column, "column");
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitColumnEquals(this);
		}

		@Override
		public String toString() {
			return "(" + column + " = " + value + ")";
		}
	}

	/** A token-list column that must contain {@code token}. */
	record ListContains(String column, String token) implements Predicate {
		public ListContains {
			Objects.requireNonNull(column, "column");
			Objects.requireNonNull(token, "token");
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitListContains(this);
		}

		@Override
		public String toString() {
			return "(" + column + " contains " + token + ")";
		}
	}

	record And(Predicate left, Predicate right) implements Predicate {
		public And {
			Objects.requireNonNull(left, "left");
			Objects.requireNonNull(right, "right");
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAnd(this);
		}

		@Override
		public String toString() {
			return "(" + left + " and " + right + ")";
		}
	}

	record Literal(boolean value) implements Predicate {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLiteral(this);
		}

		@Override
		public String toString() {
			return Boolean.toString(value);
		}
	}
}
