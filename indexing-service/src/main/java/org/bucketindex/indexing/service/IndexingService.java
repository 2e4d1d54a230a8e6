package org.bucketindex.indexing.service;

import org.bucketindex.core.encode.DocumentEncoder;
import org.bucketindex.core.model.BucketPlan;
import org.bucketindex.core.model.BucketType;
import org.bucketindex.core.model.SchemaException;
import org.bucketindex.core.plan.BucketPlanner;
import org.bucketindex.core.source.DocumentSource;
import org.bucketindex.core.source.LineDocumentSource;
import org.bucketindex.core.store.ColumnarStore;
import org.bucketindex.indexing.config.IndexingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Builds the bucket index: samples the corpus, plans the buckets, then streams the whole corpus
 * through the encoder into the store.
 */
public class IndexingService {
    private static final Logger logger = LoggerFactory.getLogger(IndexingService.class);

    private final IndexingConfig.Corpus corpus;
    private final IndexingConfig.Index index;
    private final ColumnarStore store;
    private final AtomicBoolean building = new AtomicBoolean(false);
    private volatile IndexReport lastReport;

    public IndexingService(IndexingConfig.Corpus corpus, IndexingConfig.Index index, ColumnarStore store) {
        this.corpus = corpus;
        this.index = index;
        this.store = store;
    }

    /**
     * Runs one full build. Only one build may run at a time.
     *
     * @throws BuildInProgressException if a build is already running
     * @throws org.bucketindex.core.plan.PlanningException if the sample holds no tokens
     * @throws org.bucketindex.core.encode.EncodingException if a document cannot be encoded;
     *         batches written before it stay in the store
     */
    public IndexReport build() throws IOException {
        if (!building.compareAndSet(false, true)) {
            throw new BuildInProgressException("An index build is already running");
        }
        try {
            return runBuild();
        } finally {
            building.set(false);
        }
    }

    private IndexReport runBuild() throws IOException {
        long start = System.currentTimeMillis();
        logger.info("Starting index build from {} into {}", corpus.path(), index.path());

        List<String> sample;
        BucketPlan plan;
        DocumentEncoder encoder;
        try {
            try (DocumentSource source = openCorpus()) {
                sample = BucketPlanner.sampleTokens(source, index.sampleDocuments());
            }
            plan = BucketPlanner.plan(sample, index.bucketCount());

            try (DocumentSource source = openCorpus()) {
                encoder = new DocumentEncoder(source, plan, index.chunkSize());
                store.write(encoder.columnNames(), encoder);
            }
        } catch (IOException | RuntimeException e) {
            logger.error("Index build from {} failed", corpus.path(), e);
            throw e;
        }

        IndexReport report = new IndexReport(
            encoder.documentsEncoded(),
            encoder.batchesEncoded(),
            plan.countOf(BucketType.SINGLE),
            plan.countOf(BucketType.MULTI),
            sample.size(),
            indexSize(),
            System.currentTimeMillis() - start,
            Instant.now().toString()
        );
        lastReport = report;
        logger.info("Index build complete: {} documents in {} batches, {} buckets ({} single, {} multi), {} ms",
            report.documents(), report.batches(), plan.size(), report.singleBuckets(), report.multiBuckets(),
            report.elapsedMillis());
        return report;
    }

    private DocumentSource openCorpus() throws IOException {
        return new LineDocumentSource(corpus.path(), corpus.documentLimit());
    }

    private long indexSize() throws IOException {
        return Files.isRegularFile(index.path()) ? Files.size(index.path()) : 0;
    }

    public Optional<IndexReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    public boolean isBuilding() {
        return building.get();
    }

    /**
     * Snapshot of the stored index. A store with nothing written reports zero documents.
     */
    public IndexStatus getStatus() throws IOException {
        long documents;
        int buckets;
        try {
            documents = store.rowCount();
            buckets = store.columnNames().size() - 1;
        } catch (SchemaException e) {
            logger.debug("No index stored yet: {}", e.getMessage());
            documents = 0;
            buckets = 0;
        }
        return new IndexStatus(isBuilding(), documents, buckets, indexSize(), lastReport);
    }

    public record IndexStatus(
        boolean building,
        long documentsIndexed,
        int buckets,
        long indexSizeBytes,
        IndexReport lastBuild
    ) {}
}
