package org.bucketindex.core.source;

import org.bucketindex.core.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.NoSuchElementException;

/**
 * Reads one document per line of a UTF-8 text file. The id is the zero-based line number.
 */
public class LineDocumentSource implements DocumentSource {
	private static final Logger logger = LoggerFactory.getLogger(LineDocumentSource.class);

	private final Path path;
	private final BufferedReader reader;
	private final long limit;
	private long lineNumber;
	private String nextLine;
	private boolean exhausted;

	/**
	 * @param limit maximum number of documents to read; 0 or less reads the whole file
	 */
	public LineDocumentSource(Path path, long limit) throws IOException {
		if (!Files.exists(path)) {
			throw new IOException("Corpus file not found: " + path);
		}
		this.path = path;
		this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
		this.limit = limit;
		logger.debug("Opened corpus {} (limit {})", path, limit > 0 ? limit : "none");
	}

	public LineDocumentSource(Path path) throws IOException {
		this(path, 0);
	}

	@Override
	public boolean hasNext() {
		if (nextLine != null) {
			return true;
		}
		if (exhausted || (limit > 0 && lineNumber >= limit)) {
			return false;
		}
		try {
			nextLine = reader.readLine();
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read corpus " + path, e);
		}
		if (nextLine == null) {
			exhausted = true;
			return false;
		}
		return true;
	}

	@Override
	public Document next() {
		if (!hasNext()) {
			throw new NoSuchElementException("Corpus " + path + " is exhausted");
		}
		Document document = new Document(lineNumber++, Tokenizer.tokenize(nextLine));
		nextLine = null;
		return document;
	}

	public long documentsRead() {
		return lineNumber;
	}

	@Override
	public void close() throws IOException {
		reader.close();
	}
}
