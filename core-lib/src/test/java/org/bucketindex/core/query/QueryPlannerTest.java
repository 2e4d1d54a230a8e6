package org.bucketindex.core.query;

import org.bucketindex.core.model.Bucket;
import org.bucketindex.core.model.BucketPlan;
import org.bucketindex.core.model.ColumnNames;
import org.bucketindex.core.model.SchemaException;
import org.bucketindex.core.plan.BucketPlanner;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class QueryPlannerTest {
	private final BucketPlan plan = new BucketPlan(List.of(
			Bucket.multi("apple"),
			Bucket.single("kiwi"),
			Bucket.multi("kiwi"),
			Bucket.multi("pear")
	));

	@Test
	public void testEmptyQueryMatchesNothing() throws Exception {
		assertEquals(Predicate.FALSE, QueryPlanner.plan(Set.of(), plan.columnNames()));
	}

	@Test
	public void testSingleBucketTokenUsesFlag() throws Exception {
		Predicate predicate = QueryPlanner.plan(Set.of("kiwi"), plan.columnNames());

		assertEquals(new Predicate.ColumnEquals(Bucket.single("kiwi").columnName(), true), predicate);
	}

	@Test
	public void testRangeTokenUsesListContains() throws Exception {
		Predicate predicate = QueryPlanner.plan(Set.of("lemon"), plan.columnNames());

		assertEquals(new Predicate.ListContains(Bucket.multi("kiwi").columnName(), "lemon"), predicate);
	}

	@Test
	public void testTokenBelowEveryKeyUsesFirstBucket() throws Exception {
		Predicate predicate = QueryPlanner.plan(Set.of("aardvark"), plan.columnNames());

		assertEquals(new Predicate.ListContains(Bucket.multi("apple").columnName(), "aardvark"), predicate);
	}

	@Test
	public void testTermsAreJoinedWithAnd() throws Exception {
		Predicate predicate = QueryPlanner.plan(Set.of("zucchini", "kiwi", "banana"), plan.columnNames());

		Predicate expected = new Predicate.ListContains(Bucket.multi("apple").columnName(), "banana")
				.and(new Predicate.ColumnEquals(Bucket.single("kiwi").columnName(), true))
				.and(new Predicate.ListContains(Bucket.multi("pear").columnName(), "zucchini"));
		assertEquals(expected, predicate);
		assertEquals(3, predicate.columns().size());
	}

	@Test
	public void testQueryResolutionMatchesEncoderResolution() throws Exception {
		Random random = new Random(3);
		for (int round = 0; round < 50; round++) {
			List<String> sample = new ArrayList<>();
			for (int i = 0; i < 200; i++) {
				sample.add(randomToken(random));
			}
			BucketPlan randomPlan = BucketPlanner.plan(sample, 1 + random.nextInt(40));
			QueryPlanner planner = new QueryPlanner(randomPlan.columnNames());

			for (int i = 0; i < 200; i++) {
				String token = randomToken(random);
				assertEquals(randomPlan.resolve(token) + 1, planner.resolveColumn(token), token + " in " + randomPlan);
			}
		}
	}

	@Test
	public void testPlannerRecoversPlanFromSchema() throws Exception {
		assertEquals(plan, new QueryPlanner(plan.columnNames()).bucketPlan());
	}

	@Test
	public void testSchemaWithoutIdColumnIsRejected() {
		List<String> names = plan.columnNames().subList(1, plan.size() + 1);

		assertThrows(SchemaException.class, () -> new QueryPlanner(names));
		assertThrows(SchemaException.class, () -> new QueryPlanner(List.of(ColumnNames.ID_COLUMN)));
	}

	private static String randomToken(Random random) {
		String alphabet = "ab1z'";
		StringBuilder token = new StringBuilder();
		int length = 1 + random.nextInt(4);
		for (int i = 0; i < length; i++) {
			token.append(alphabet.charAt(random.nextInt(alphabet.length())));
		}
		return token.toString();
	}
}
