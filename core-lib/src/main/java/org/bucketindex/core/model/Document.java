package org.bucketindex.core.model;

import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;
import java.util.Set;

/**
 * A document as seen by the index: an unsigned 64-bit identifier and its set of normalized tokens.
 *
 * <p>The identifier is carried in a {@code long}; values above {@link Long#MAX_VALUE} appear negative
 * and are rendered with {@link Long#toUnsignedString(long)}.</p>
 */
public record Document(
		long id,
		Set<String> tokens
) implements Serializable {

	public String idString() {
		return Long.toUnsignedString(id);
	}

	@NotNull
	@Override
	public String toString() {
		return String.format("Document{id=%s, tokens=%d}",
				idString(), tokens == null ? 0 : tokens.size());
	}

	@Serial
	private static final long serialVersionUID = 1L;
}
