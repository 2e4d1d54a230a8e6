package org.bucketindex.core.plan;

import org.bucketindex.core.model.Bucket;
import org.bucketindex.core.model.BucketPlan;
import org.bucketindex.core.model.BucketType;
import org.bucketindex.core.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Chooses bucket boundaries that split a token sample into roughly equal ranges.
 */
public final class BucketPlanner {
	private static final Logger logger = LoggerFactory.getLogger(BucketPlanner.class);

	/** Largest bucket count a plan may be asked for; bucket numbers fit in an unsigned 16-bit value. */
	public static final int MAX_BUCKET_COUNT = 65535;

	private BucketPlanner() {}

	/**
	 * Derive a bucket plan from a non-unique token sample.
	 *
	 * <p>Candidate {@code i} is the sorted sample's token at {@code floor(i * len / bucketCount)}.
	 * A candidate repeated once becomes a {@link BucketType#SINGLE} bucket; every change of value
	 * closes the previous one as {@link BucketType#MULTI}, and the last candidate is always emitted
	 * as the {@code MULTI} catch-all.</p>
	 *
	 * @param sample tokens drawn from the corpus; duplicates are meaningful
	 * @param bucketCount number of quantile ranges, between 1 and {@link #MAX_BUCKET_COUNT}
	 * @throws PlanningException if the sample is empty or the bucket count is out of range
	 */
	public static BucketPlan plan(List<String> sample, int bucketCount) {
		if (sample == null || sample.isEmpty()) {
			throw new PlanningException("Cannot plan buckets from an empty sample");
		}
		if (bucketCount <= 0) {
			throw new PlanningException("Bucket count must be positive, got " + bucketCount);
		}
		if (bucketCount > MAX_BUCKET_COUNT) {
			throw new PlanningException("Bucket count must be at most " + MAX_BUCKET_COUNT + ", got " + bucketCount);
		}

		List<String> sorted = new ArrayList<>(sample);
		sorted.sort(null);
		int len = sorted.size();

		List<Bucket> buckets = new ArrayList<>(Math.min(bucketCount, len) + 1);
		String previous = sorted.get(0);
		boolean singleEmitted = false;
		for (int i = 1; i < bucketCount; i++) {
			String candidate = sorted.get((int) ((long) i * len / bucketCount));
			if (!candidate.equals(previous)) {
				buckets.add(Bucket.multi(previous));
				singleEmitted = false;
			} else if (!singleEmitted) {
				buckets.add(Bucket.single(previous));
				singleEmitted = true;
			}
			previous = candidate;
		}
		buckets.add(Bucket.multi(previous));

		BucketPlan plan = new BucketPlan(buckets);
		logger.info("Planned {} buckets ({} single, {} multi) from {} sample tokens",
				plan.size(), plan.countOf(BucketType.SINGLE), plan.countOf(BucketType.MULTI), len);
		return plan;
	}

	/**
	 * Collect the tokens of the first {@code documentCount} documents. The sample is a prefix of the
	 * corpus, so an unshuffled corpus skews the boundaries towards its beginning.
	 */
	public static List<String> sampleTokens(Iterator<Document> documents, int documentCount) {
		List<String> sample = new ArrayList<>();
		int taken = 0;
		while (taken < documentCount && documents.hasNext()) {
			Document document = documents.next();
			if (document.tokens() != null) {
				sample.addAll(document.tokens());
			}
			taken++;
		}
		logger.debug("Sampled {} tokens from {} documents", sample.size(), taken);
		return sample;
	}
}
