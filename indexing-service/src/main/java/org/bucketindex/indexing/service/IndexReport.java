package org.bucketindex.indexing.service;

/**
 * Outcome of one index build.
 *
 * @param documents documents encoded and written
 * @param batches batches written
 * @param singleBuckets buckets stored as presence flags
 * @param multiBuckets buckets stored as token lists
 * @param sampleTokens size of the token sample the plan was drawn from
 * @param indexSizeBytes size of the index file after the build, {@code 0} when not file backed
 * @param elapsedMillis wall time of the whole build
 * @param completedAt ISO-8601 completion time
 */
public record IndexReport(
    long documents,
    long batches,
    int singleBuckets,
    int multiBuckets,
    int sampleTokens,
    long indexSizeBytes,
    long elapsedMillis,
    String completedAt
) {}
