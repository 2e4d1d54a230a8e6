package org.bucketindex.core.model;

/**
 * Lossless mapping between buckets and stored column names.
 *
 * <p>A bucket column is named {@code k_} followed by four letters per UTF-16 unit of the key
 * (one letter {@code a..p} per nibble, most significant first) and closed by the type suffix
 * {@code 0} or {@code 1}. The alphabet is a valid Avro/Parquet identifier, and the mapping is
 * order-preserving: {@code a.compareTo(b)} and {@code encode(a).compareTo(encode(b))} always have
 * the same sign. The id column name sorts before every bucket column.</p>
 */
public final class ColumnNames {
	public static final String ID_COLUMN = "_id";

	private static final String BUCKET_PREFIX = "k_";
	private static final int LETTERS_PER_CHAR = 4;

	private ColumnNames() {}

	public static String encode(Bucket bucket) {
		return encode(bucket.key(), bucket.type());
	}

	public static String encode(String key, BucketType type) {
		StringBuilder name = new StringBuilder(BUCKET_PREFIX.length() + key.length() * LETTERS_PER_CHAR + 1);
		name.append(BUCKET_PREFIX);
		for (int i = 0; i < key.length(); i++) {
			char c = key.charAt(i);
			for (int shift = 12; shift >= 0; shift -= 4) {
				name.append((char) ('a' + ((c >> shift) & 0xF)));
			}
		}
		name.append(type.suffix());
		return name.toString();
	}

	/**
	 * Decodes a bucket column name.
	 *
	 * @throws SchemaException if {@code name} is not a bucket column produced by {@link #encode}
	 */
	public static Bucket decode(String name) throws SchemaException {
		if (name == null || !name.startsWith(BUCKET_PREFIX)) {
			throw new SchemaException("Not a bucket column: " + name);
		}

		int bodyLength = name.length() - BUCKET_PREFIX.length() - 1;
		if (bodyLength < 0 || bodyLength % LETTERS_PER_CHAR != 0) {
			throw new SchemaException("Malformed bucket column name: " + name);
		}

		BucketType type;
		try {
			type = BucketType.fromSuffix(name.charAt(name.length() - 1));
		} catch (IllegalArgumentException e) {
			throw new SchemaException("Malformed bucket column name: " + name, e);
		}

		StringBuilder key = new StringBuilder(bodyLength / LETTERS_PER_CHAR);
		int pos = BUCKET_PREFIX.length();
		for (int i = 0; i < bodyLength / LETTERS_PER_CHAR; i++) {
			int c = 0;
			for (int j = 0; j < LETTERS_PER_CHAR; j++) {
				char letter = name.charAt(pos++);
				if (letter < 'a' || letter > 'p') {
					throw new SchemaException("Malformed bucket column name: " + name);
				}
				c = (c << 4) | (letter - 'a');
			}
			key.append((char) c);
		}
		return new Bucket(key.toString(), type);
	}

	public static boolean isIdColumn(String name) {
		return ID_COLUMN.equals(name);
	}
}
