package org.bucketindex.core.query;

import org.bucketindex.core.model.Batch;
import org.bucketindex.core.model.BatchColumn;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PredicateEvaluatorTest {
	private final Batch batch = new Batch(new long[] {1, 2, 3}, List.of(
			new BatchColumn.FlagColumn("flag", new boolean[] {true, false, true}),
			new BatchColumn.TokenListColumn("words", List.of(List.of("foo", "bar"), List.of("foo"), List.of()))
	));

	@Test
	public void testColumnEquals() {
		assertArrayEquals(new boolean[] {true, false, true},
				PredicateEvaluator.evaluate(new Predicate.ColumnEquals("flag", true), batch));
		assertArrayEquals(new boolean[] {false, true, false},
				PredicateEvaluator.evaluate(new Predicate.ColumnEquals("flag", false), batch));
	}

	@Test
	public void testListContains() {
		assertArrayEquals(new boolean[] {true, true, false},
				PredicateEvaluator.evaluate(new Predicate.ListContains("words", "foo"), batch));
		assertArrayEquals(new boolean[] {false, false, false},
				PredicateEvaluator.evaluate(new Predicate.ListContains("words", "baz"), batch));
	}

	@Test
	public void testAnd() {
		Predicate predicate = new Predicate.ColumnEquals("flag", true).and(new Predicate.ListContains("words", "foo"));

		boolean[] mask = PredicateEvaluator.evaluate(predicate, batch);

		assertArrayEquals(new boolean[] {true, false, false}, mask);
		assertEquals(1, PredicateEvaluator.count(mask));
	}

	@Test
	public void testFalseLiteral() {
		assertEquals(0, PredicateEvaluator.count(PredicateEvaluator.evaluate(Predicate.FALSE, batch)));
	}

	@Test
	public void testWrongColumnShape() {
		assertThrows(IllegalStateException.class,
				() -> PredicateEvaluator.evaluate(new Predicate.ListContains("flag", "foo"), batch));
		assertThrows(IllegalStateException.class,
				() -> PredicateEvaluator.evaluate(new Predicate.ColumnEquals("missing", true), batch));
	}
}
