package org.bucketindex.core.source;

import org.bucketindex.core.model.Document;

import java.io.Closeable;
import java.util.Iterator;

/**
 * Single-pass supply of documents. Open a new source to read the corpus again.
 */
public interface DocumentSource extends Iterator<Document>, Closeable {
}
