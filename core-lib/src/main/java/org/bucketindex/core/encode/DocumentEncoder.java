package org.bucketindex.core.encode;

import org.bucketindex.core.model.Batch;
import org.bucketindex.core.model.BatchColumn;
import org.bucketindex.core.model.Bucket;
import org.bucketindex.core.model.BucketPlan;
import org.bucketindex.core.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Streams documents through a fixed bucket plan, one chunk per {@link #next()}.
 *
 * <p>Each pull reads up to {@code chunkSize} documents from the source, resolves every token to its
 * bucket with {@link BucketPlan#resolve(String)} and finalizes a fresh set of column builders into
 * an immutable {@link Batch}. Nothing but the source position survives between chunks. Not
 * thread-safe: the source has exactly one consumer.</p>
 */
public class DocumentEncoder implements Iterator<Batch> {
	private static final Logger logger = LoggerFactory.getLogger(DocumentEncoder.class);

	public static final int DEFAULT_CHUNK_SIZE = 8192;
	private static final int MAX_INITIAL_CAPACITY = 1024;

	private final Iterator<Document> documents;
	private final BucketPlan plan;
	private final int chunkSize;
	private final List<String> columnNames;
	private final List<List<String>> pending;

	private long documentsEncoded;
	private long batchesEncoded;

	public DocumentEncoder(Iterator<Document> documents, BucketPlan plan) {
		this(documents, plan, DEFAULT_CHUNK_SIZE);
	}

	public DocumentEncoder(Iterator<Document> documents, BucketPlan plan, int chunkSize) {
		if (chunkSize <= 0) {
			throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
		}
		this.documents = documents;
		this.plan = plan;
		this.chunkSize = chunkSize;
		this.columnNames = plan.columnNames();
		this.pending = new ArrayList<>(plan.size());
		for (int i = 0; i < plan.size(); i++) {
			pending.add(new ArrayList<>());
		}
	}

	@Override
	public boolean hasNext() {
		return documents.hasNext();
	}

	/**
	 * Encode the next chunk.
	 *
	 * @throws EncodingException if a document in the chunk is corrupted; the chunk is dropped
	 */
	@Override
	public Batch next() {
		if (!hasNext()) {
			throw new NoSuchElementException("No more documents to encode");
		}

		int capacity = Math.min(chunkSize, MAX_INITIAL_CAPACITY);
		List<ColumnBuilder> builders = new ArrayList<>(plan.size());
		for (int i = 0; i < plan.size(); i++) {
			Bucket bucket = plan.bucket(i);
			builders.add(ColumnBuilder.forType(columnNames.get(i + 1), bucket.type(), capacity));
		}
		long[] ids = new long[capacity];

		int count = 0;
		try {
			while (count < chunkSize && documents.hasNext()) {
				Document document = documents.next();
				if (count == ids.length) {
					ids = Arrays.copyOf(ids, Math.min(ids.length * 2, chunkSize));
				}
				ids[count] = appendDocument(document, builders);
				count++;
			}
		} finally {
			pending.forEach(List::clear);
		}

		List<BatchColumn> columns = new ArrayList<>(builders.size());
		for (ColumnBuilder builder : builders) {
			columns.add(builder.finish());
		}

		Batch batch;
		try {
			batch = new Batch(Arrays.copyOf(ids, count), columns);
		} catch (IllegalArgumentException e) {
			throw new EncodingException("Failed to finalize batch " + batchesEncoded + ": " + e.getMessage(), e);
		}

		documentsEncoded += count;
		batchesEncoded++;
		logger.debug("Encoded batch {} with {} documents", batchesEncoded, count);
		return batch;
	}

	private long appendDocument(Document document, List<ColumnBuilder> builders) {
		if (document == null) {
			throw new EncodingException("Document source returned null after " + documentsEncoded + " documents");
		}
		if (document.tokens() == null) {
			throw new EncodingException("Document " + document.idString() + " has no token set");
		}

		// Sorted traversal keeps the list columns deterministic for equal token sets.
		List<String> tokens = new ArrayList<>(document.tokens().size());
		for (String token : document.tokens()) {
			if (token == null) {
				throw new EncodingException("Document " + document.idString() + " contains a null token");
			}
			tokens.add(token);
		}
		tokens.sort(null);

		for (String token : tokens) {
			pending.get(plan.resolve(token)).add(token);
		}
		for (int i = 0; i < builders.size(); i++) {
			List<String> entries = pending.get(i);
			builders.get(i).append(entries);
			entries.clear();
		}
		return document.id();
	}

	public long documentsEncoded() {
		return documentsEncoded;
	}

	public long batchesEncoded() {
		return batchesEncoded;
	}

	public BucketPlan plan() {
		return plan;
	}

	/**
	 * Schema shared by every batch this encoder produces.
	 */
	public List<String> columnNames() {
		return columnNames;
	}
}
