package org.bucketindex.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BucketPlanTest {
	private final BucketPlan plan = new BucketPlan(List.of(
			Bucket.multi("apple"),
			Bucket.single("kiwi"),
			Bucket.multi("kiwi"),
			Bucket.multi("pear")
	));

	@Test
	public void testExactSingleMatch() {
		assertEquals(1, plan.resolve("kiwi"));
	}

	@Test
	public void testTokenBelowEveryKeyGoesToFirstBucket() {
		assertEquals(0, plan.resolve("aardvark"));
		assertEquals(0, plan.resolve(""));
	}

	@Test
	public void testTokensBetweenKeys() {
		assertEquals(0, plan.resolve("banana"));
		assertEquals(2, plan.resolve("lemon"));
		assertEquals(3, plan.resolve("plum"));
		assertEquals(3, plan.resolve("zucchini"));
	}

	@Test
	public void testKeyOfMultiBucketFallsIntoPreviousBucket() {
		// (pear, SINGLE) sorts before (pear, MULTI), so the probe lands just before it
		assertEquals(2, plan.resolve("pear"));
		assertEquals(0, plan.resolve("apple"));
	}

	@Test
	public void testRoundTripThroughColumnNames() throws Exception {
		List<String> names = plan.columnNames();

		assertEquals(ColumnNames.ID_COLUMN, names.get(0));
		assertEquals(5, names.size());
		assertEquals(plan, BucketPlan.fromColumnNames(names));
	}

	@Test
	public void testInvalidPlansAreRejected() {
		assertThrows(IllegalArgumentException.class, () -> new BucketPlan(List.of()));
		assertThrows(IllegalArgumentException.class, () -> new BucketPlan(List.of(Bucket.single("a"))));
		assertThrows(IllegalArgumentException.class,
				() -> new BucketPlan(List.of(Bucket.multi("b"), Bucket.multi("a"))));
		assertThrows(IllegalArgumentException.class,
				() -> new BucketPlan(List.of(Bucket.multi("a"), Bucket.multi("a"))));
	}

	@Test
	public void testBadSchemasAreRejected() {
		String a = Bucket.multi("a").columnName();
		String b = Bucket.multi("b").columnName();

		assertThrows(SchemaException.class, () -> BucketPlan.fromColumnNames(List.of(ColumnNames.ID_COLUMN)));
		assertThrows(SchemaException.class, () -> BucketPlan.fromColumnNames(List.of("id", a)));
		assertThrows(SchemaException.class, () -> BucketPlan.fromColumnNames(List.of(ColumnNames.ID_COLUMN, b, a)));
		assertThrows(SchemaException.class, () -> BucketPlan.fromColumnNames(List.of(ColumnNames.ID_COLUMN, "body")));
	}

	@Test
	public void testBucketTypeCounts() {
		assertEquals(1, plan.countOf(BucketType.SINGLE));
		assertEquals(3, plan.countOf(BucketType.MULTI));
	}
}
