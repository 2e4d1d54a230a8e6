package org.bucketindex.core.model;

import org.jetbrains.annotations.NotNull;

import java.util.Comparator;
import java.util.Objects;

/**
 * A boundary of the token keyspace together with the storage shape of its column.
 * Buckets order by key, then by type ({@link BucketType#SINGLE} first).
 */
public record Bucket(String key, BucketType type) implements Comparable<Bucket> {
	private static final Comparator<Bucket> ORDER =
			Comparator.comparing(Bucket::key).thenComparing(Bucket::type);

	public Bucket {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(type, "type");
	}

	public static Bucket single(String key) {
		return new Bucket(key, BucketType.SINGLE);
	}

	public static Bucket multi(String key) {
		return new Bucket(key, BucketType.MULTI);
	}

	public String columnName() {
		return ColumnNames.encode(this);
	}

	@Override
	public int compareTo(@NotNull Bucket other) {
		return ORDER.compare(this, other);
	}

	@NotNull
	@Override
	public String toString() {
		return "(" + key + ", " + type + ")";
	}
}
