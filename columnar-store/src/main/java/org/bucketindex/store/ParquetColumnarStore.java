package org.bucketindex.store;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.avro.AvroReadSupport;
import org.apache.parquet.avro.AvroSchemaConverter;
import org.apache.parquet.filter2.compat.FilterCompat;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.metadata.FileMetaData;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.bucketindex.core.model.Batch;
import org.bucketindex.core.model.BatchColumn;
import org.bucketindex.core.model.SchemaException;
import org.bucketindex.core.query.Predicate;
import org.bucketindex.core.query.QueryEvaluationException;
import org.bucketindex.core.store.BatchMatch;
import org.bucketindex.core.store.BatchScanner;
import org.bucketindex.core.store.ColumnarStore;
import org.bucketindex.core.store.Projection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Stores an index as a single Parquet file written through the Avro object model.
 *
 * <p>Flag comparisons are pushed into the Parquet reader as a record filter and only the id column
 * plus the columns the predicate reads are decoded. Surviving records are regrouped into batches of
 * the chunk size recorded at write time and evaluated again with the shared batch evaluator, which
 * also settles the list-membership terms Parquet cannot filter on.</p>
 */
public class ParquetColumnarStore implements ColumnarStore {
	private static final Logger logger = LoggerFactory.getLogger(ParquetColumnarStore.class);

	static final String AVRO_SCHEMA_KEY = "parquet.avro.schema";
	static final String CHUNK_SIZE_KEY = "bucketindex.chunk.size";
	static final String BUCKET_COUNT_KEY = "bucketindex.bucket.count";

	private final Path file;
	private final CompressionCodecName codec;
	private final int chunkSize;

	public ParquetColumnarStore(Path file) {
		this(file, CompressionCodecName.SNAPPY, 8192);
	}

	public ParquetColumnarStore(Path file, CompressionCodecName codec, int chunkSize) {
		if (chunkSize <= 0) {
			throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
		}
		this.file = file;
		this.codec = codec;
		this.chunkSize = chunkSize;
	}

	/**
	 * Replaces any index already stored at the path. Batches are written to a sibling staging file
	 * that is moved over the path once the writer is closed, so readers keep seeing the previous
	 * index until then. When the batch source fails, the batches written before the failure are
	 * still published.
	 */
	@Override
	public void write(List<String> columnNames, Iterator<Batch> batches) throws IOException {
		Schema schema = AvroSchemas.forColumns(columnNames);
		Map<String, String> metadata = Map.of(
				CHUNK_SIZE_KEY, Integer.toString(chunkSize),
				BUCKET_COUNT_KEY, Integer.toString(columnNames.size() - 1));
		Path staging = stagingFile();

		long start = System.currentTimeMillis();
		long rows = 0;
		int written = 0;
		try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(new NioOutputFile(staging))
				.withSchema(schema)
				.withCompressionCodec(codec)
				.withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
				.withExtraMetaData(metadata)
				.build()) {
			while (batches.hasNext()) {
				Batch batch = batches.next();
				if (!batch.columnNames().equals(columnNames)) {
					throw new IOException("Batch schema " + batch.columnNames() + " does not match " + columnNames);
				}
				writeBatch(writer, schema, batch);
				rows += batch.rowCount();
				written++;
			}
		} catch (IOException | RuntimeException e) {
			publishPartial(staging, e);
			throw e;
		} finally {
			logger.info("Wrote {} batches ({} rows) to {} in {} ms",
					written, rows, file, System.currentTimeMillis() - start);
		}
		publish(staging);
	}

	Path stagingFile() {
		return file.resolveSibling(file.getFileName() + ".writing");
	}

	private void publishPartial(Path staging, Exception failure) {
		try {
			readFooter(staging);
			publish(staging);
			logger.warn("Published the batches written to {} before the failure", file);
		} catch (IOException | RuntimeException incomplete) {
			failure.addSuppressed(incomplete);
			try {
				Files.deleteIfExists(staging);
			} catch (IOException e) {
				failure.addSuppressed(e);
			}
		}
	}

	private void publish(Path staging) throws IOException {
		try {
			Files.move(staging, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			logger.debug("Atomic move unsupported for {}, replacing it directly", file);
			Files.move(staging, file, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private void writeBatch(ParquetWriter<GenericRecord> writer, Schema schema, Batch batch) throws IOException {
		List<BatchColumn> columns = batch.columns();
		for (int row = 0; row < batch.rowCount(); row++) {
			GenericRecord record = new GenericData.Record(schema);
			record.put(0, batch.id(row));
			for (int c = 0; c < columns.size(); c++) {
				BatchColumn column = columns.get(c);
				if (column instanceof BatchColumn.FlagColumn flags) {
					record.put(c + 1, flags.get(row));
				} else if (column instanceof BatchColumn.TokenListColumn lists) {
					record.put(c + 1, lists.get(row));
				}
			}
			writer.write(record);
		}
	}

	@Override
	public List<String> columnNames() throws IOException {
		Schema schema = fileSchema();
		List<String> names = new ArrayList<>(schema.getFields().size());
		for (Schema.Field field : schema.getFields()) {
			names.add(field.name());
		}
		return names;
	}

	@Override
	public List<BatchMatch> scan(Predicate filter, Projection projection) throws IOException {
		if (filter instanceof Predicate.Literal literal && !literal.value()) {
			return List.of();
		}

		FileMetaData footer = footer();
		Schema projected = AvroSchemas.project(avroSchema(footer), filter.columns());
		int batchSize = storedChunkSize(footer);

		Configuration conf = new Configuration();
		AvroReadSupport.setRequestedProjection(conf, projected);
		AvroReadSupport.setAvroReadSchema(conf, projected);
		FilterCompat.Filter pushdown = ParquetFilters.toFilter(filter);

		List<BatchMatch> matches = new ArrayList<>();
		try (ParquetReader<GenericRecord> reader = AvroParquetReader.<GenericRecord>builder(new NioInputFile(file))
				.withDataModel(GenericData.get())
				.withConf(conf)
				.withFilter(pushdown)
				.build()) {
			RecordChunk chunk = new RecordChunk(projected, batchSize);
			GenericRecord record;
			while ((record = reader.read()) != null) {
				chunk.add(record);
				if (chunk.isFull()) {
					matches.add(BatchScanner.match(chunk.drain(), filter, projection));
				}
			}
			if (!chunk.isEmpty()) {
				matches.add(BatchScanner.match(chunk.drain(), filter, projection));
			}
		} catch (IOException | RuntimeException e) {
			throw new QueryEvaluationException("Failed to evaluate " + filter + " over " + file, e);
		}
		logger.debug("Scanned {} batches of {} for {}", matches.size(), file, filter);
		return matches;
	}

	@Override
	public long rowCount() throws IOException {
		requireFile();
		long rows = 0;
		for (BlockMetaData block : readFooter(file).getBlocks()) {
			rows += block.getRowCount();
		}
		return rows;
	}

	public Path file() {
		return file;
	}

	@Override
	public void close() {
		logger.debug("Closed Parquet store {}", file);
	}

	private FileMetaData footer() throws IOException {
		requireFile();
		return readFooter(file).getFileMetaData();
	}

	/**
	 * Parquet reports a truncated or foreign file with an unchecked exception; it is surfaced here
	 * as a {@link SchemaException} like every other unreadable index.
	 */
	private static ParquetMetadata readFooter(Path path) throws IOException {
		try (ParquetFileReader reader = ParquetFileReader.open(new NioInputFile(path))) {
			return reader.getFooter();
		} catch (RuntimeException e) {
			throw new SchemaException("Not a readable index: " + path, e);
		}
	}

	private Schema fileSchema() throws IOException {
		return avroSchema(footer());
	}

	private Schema avroSchema(FileMetaData footer) throws SchemaException {
		try {
			String json = footer.getKeyValueMetaData().get(AVRO_SCHEMA_KEY);
			if (json != null) {
				return new Schema.Parser().parse(json);
			}
			return new AvroSchemaConverter().convert(footer.getSchema());
		} catch (RuntimeException e) {
			throw new SchemaException("Unreadable schema in " + file, e);
		}
	}

	private int storedChunkSize(FileMetaData footer) {
		String stored = footer.getKeyValueMetaData().get(CHUNK_SIZE_KEY);
		if (stored == null) {
			return chunkSize;
		}
		try {
			return Integer.parseInt(stored);
		} catch (NumberFormatException e) {
			logger.warn("Ignoring malformed {}='{}' in {}", CHUNK_SIZE_KEY, stored, file);
			return chunkSize;
		}
	}

	private void requireFile() throws SchemaException {
		if (!Files.isRegularFile(file)) {
			throw new SchemaException("No index stored at " + file);
		}
	}

	/**
	 * Accumulates decoded records column by column until a batch is full.
	 */
	private static final class RecordChunk {
		private final int capacity;
		private final List<ColumnAccumulator> columns;
		private long[] ids;
		private int size;

		RecordChunk(Schema schema, int capacity) {
			this.capacity = capacity;
			List<Schema.Field> fields = schema.getFields();
			this.columns = new ArrayList<>(fields.size() - 1);
			for (int f = 1; f < fields.size(); f++) {
				columns.add(ColumnAccumulator.forField(fields.get(f), capacity));
			}
			this.ids = new long[capacity];
		}

		void add(GenericRecord record) {
			ids[size] = (Long) record.get(0);
			for (int c = 0; c < columns.size(); c++) {
				columns.get(c).add(record.get(c + 1));
			}
			size++;
		}

		boolean isFull() {
			return size == capacity;
		}

		boolean isEmpty() {
			return size == 0;
		}

		Batch drain() {
			List<BatchColumn> batchColumns = new ArrayList<>(columns.size());
			for (ColumnAccumulator column : columns) {
				batchColumns.add(column.drain());
			}
			Batch batch = new Batch(Arrays.copyOf(ids, size), batchColumns);
			size = 0;
			return batch;
		}
	}

	/** One projected column of a {@link RecordChunk}. */
	private interface ColumnAccumulator {

		void add(Object value);

		/** Hand out the rows added since the last drain and start over. */
		BatchColumn drain();

		static ColumnAccumulator forField(Schema.Field field, int capacity) {
			if (field.schema().getType() == Schema.Type.BOOLEAN) {
				return new FlagAccumulator(field.name(), capacity);
			}
			return new TokenListAccumulator(field.name(), capacity);
		}
	}

	private static final class FlagAccumulator implements ColumnAccumulator {
		private final String name;
		private final boolean[] flags;
		private int size;

		FlagAccumulator(String name, int capacity) {
			this.name = name;
			this.flags = new boolean[capacity];
		}

		@Override
		public void add(Object value) {
			flags[size++] = Boolean.TRUE.equals(value);
		}

		@Override
		public BatchColumn drain() {
			BatchColumn column = new BatchColumn.FlagColumn(name, Arrays.copyOf(flags, size));
			size = 0;
			return column;
		}
	}

	private static final class TokenListAccumulator implements ColumnAccumulator {
		private final String name;
		private final int capacity;
		private List<List<String>> rows;

		TokenListAccumulator(String name, int capacity) {
			this.name = name;
			this.capacity = capacity;
			this.rows = new ArrayList<>(capacity);
		}

		@Override
		public void add(Object value) {
			if (value == null) {
				rows.add(List.of());
				return;
			}
			Collection<?> items = (Collection<?>) value;
			List<String> tokens = new ArrayList<>(items.size());
			for (Object item : items) {
				tokens.add(item.toString());
			}
			rows.add(tokens);
		}

		@Override
		public BatchColumn drain() {
			BatchColumn column = new BatchColumn.TokenListColumn(name, rows);
			rows = new ArrayList<>(capacity);
			return column;
		}
	}
}
