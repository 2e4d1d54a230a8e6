package org.bucketindex.benchmarks.baseline;

import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.bucketindex.core.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Exact inverted index over the same documents, used as the reference the bucket index is
 * measured against. Every token is indexed verbatim as a {@link StringField}; the document id is
 * stored alongside.
 */
public class LuceneBaselineIndex implements Closeable {
	private static final Logger logger = LoggerFactory.getLogger(LuceneBaselineIndex.class);

	static final String ID_FIELD = "id";
	static final String TOKENS_FIELD = "tokens";

	private final Directory directory;
	private DirectoryReader reader;
	private IndexSearcher searcher;

	private LuceneBaselineIndex(Directory directory) {
		this.directory = directory;
	}

	public static LuceneBaselineIndex inMemory() {
		return new LuceneBaselineIndex(new ByteBuffersDirectory());
	}

	public static LuceneBaselineIndex onDisk(Path path) throws IOException {
		return new LuceneBaselineIndex(FSDirectory.open(path));
	}

	/**
	 * Replace the index content with {@code documents} and open a searcher over it.
	 *
	 * @return number of documents indexed
	 */
	public long build(Iterator<Document> documents) throws IOException {
		long start = System.currentTimeMillis();
		long indexed = 0;
		IndexWriterConfig config = new IndexWriterConfig();
		config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
		try (IndexWriter writer = new IndexWriter(directory, config)) {
			while (documents.hasNext()) {
				writer.addDocument(toLucene(documents.next()));
				indexed++;
			}
			writer.commit();
		}
		reopen();
		logger.info("Built baseline index with {} documents in {} ms", indexed, System.currentTimeMillis() - start);
		return indexed;
	}

	private static org.apache.lucene.document.Document toLucene(Document document) {
		org.apache.lucene.document.Document doc = new org.apache.lucene.document.Document();
		doc.add(new StoredField(ID_FIELD, document.id()));
		for (String token : document.tokens()) {
			doc.add(new StringField(TOKENS_FIELD, token, Field.Store.NO));
		}
		return doc;
	}

	private void reopen() throws IOException {
		if (reader != null) {
			reader.close();
		}
		reader = DirectoryReader.open(directory);
		searcher = new IndexSearcher(reader);
	}

	/**
	 * Documents containing every token. No tokens counts as zero, like the bucket index.
	 */
	public long count(Set<String> tokens) throws IOException {
		if (tokens.isEmpty()) {
			return 0;
		}
		return requireSearcher().count(conjunction(tokens));
	}

	/**
	 * Ids of the first {@code limit} matches in index order.
	 */
	public List<Long> topIds(Set<String> tokens, int limit) throws IOException {
		if (tokens.isEmpty() || limit <= 0) {
			return List.of();
		}
		IndexSearcher current = requireSearcher();
		ScoreDoc[] hits = current.search(conjunction(tokens), limit, Sort.INDEXORDER).scoreDocs;
		StoredFields stored = current.storedFields();
		List<Long> ids = new ArrayList<>(hits.length);
		for (ScoreDoc hit : hits) {
			ids.add(stored.document(hit.doc).getField(ID_FIELD).numericValue().longValue());
		}
		return ids;
	}

	public int documentCount() throws IOException {
		return requireSearcher().getIndexReader().numDocs();
	}

	private static Query conjunction(Set<String> tokens) {
		BooleanQuery.Builder query = new BooleanQuery.Builder();
		for (String token : new TreeSet<>(tokens)) {
			query.add(new TermQuery(new Term(TOKENS_FIELD, token)), BooleanClause.Occur.FILTER);
		}
		return query.build();
	}

	private IndexSearcher requireSearcher() {
		if (searcher == null) {
			throw new IllegalStateException("Baseline index has not been built");
		}
		return searcher;
	}

	@Override
	public void close() throws IOException {
		if (reader != null) {
			reader.close();
		}
		directory.close();
	}
}
