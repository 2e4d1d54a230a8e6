package org.bucketindex.core.model;

/**
 * Storage shape of a bucket column.
 *
 * <p>Declaration order matters: {@link #SINGLE} must sort before {@link #MULTI} because every lookup
 * probes for an exact single-valued match first.</p>
 */
public enum BucketType {
	/** One distinct token in the sample; stored as a presence flag per document. */
	SINGLE('0'),
	/** A range of tokens; stored as the list of matching tokens per document. */
	MULTI('1');

	private final char suffix;

	BucketType(char suffix) {
		this.suffix = suffix;
	}

	/**
	 * Character closing a column name of this type. Both suffixes sort below every character used to
	 * encode a key, which keeps shorter keys ahead of their extensions.
	 */
	public char suffix() {
		return suffix;
	}

	public static BucketType fromSuffix(char suffix) {
		for (BucketType type : values()) {
			if (type.suffix == suffix) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown bucket type suffix: '" + suffix + "'");
	}
}
