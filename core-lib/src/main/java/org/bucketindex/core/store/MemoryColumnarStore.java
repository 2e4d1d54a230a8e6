package org.bucketindex.core.store;

import org.bucketindex.core.model.Batch;
import org.bucketindex.core.model.SchemaException;
import org.bucketindex.core.query.Predicate;
import org.bucketindex.core.query.QueryEvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps batches on the heap. Scans run over the batches in parallel and report them in stored
 * order.
 */
public class MemoryColumnarStore implements ColumnarStore {
	private static final Logger logger = LoggerFactory.getLogger(MemoryColumnarStore.class);

	private final List<Batch> batches = new CopyOnWriteArrayList<>();
	private volatile List<String> columnNames;

	@Override
	public void write(List<String> columnNames, Iterator<Batch> source) throws IOException {
		if (this.columnNames != null) {
			throw new IOException("Store already holds an index; batches are write-once");
		}
		this.columnNames = List.copyOf(columnNames);

		int written = 0;
		while (source.hasNext()) {
			Batch batch = source.next();
			if (!batch.columnNames().equals(this.columnNames)) {
				throw new IOException("Batch schema " + batch.columnNames() + " does not match " + this.columnNames);
			}
			batches.add(batch);
			written++;
		}
		logger.info("Stored {} batches in memory ({} rows)", written, rowCount());
	}

	@Override
	public List<String> columnNames() throws SchemaException {
		if (columnNames == null) {
			throw new SchemaException("Store is empty");
		}
		return columnNames;
	}

	@Override
	public List<BatchMatch> scan(Predicate filter, Projection projection) throws QueryEvaluationException {
		try {
			return batches.parallelStream()
					.map(batch -> BatchScanner.match(batch, filter, projection))
					.toList();
		} catch (RuntimeException e) {
			throw new QueryEvaluationException("Failed to evaluate " + filter, e);
		}
	}

	@Override
	public long rowCount() {
		return batches.stream().mapToLong(Batch::rowCount).sum();
	}

	public List<Batch> batches() {
		return Collections.unmodifiableList(new ArrayList<>(batches));
	}

	@Override
	public void close() {
		logger.debug("Closed in-memory store with {} batches", batches.size());
	}
}
