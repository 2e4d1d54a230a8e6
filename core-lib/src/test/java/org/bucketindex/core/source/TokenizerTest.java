package org.bucketindex.core.source;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TokenizerTest {

	@Test
	public void testNormalization() {
		Set<String> tokens = Tokenizer.tokenize("  \"Hello,\" said   the OLD man -- don't   go! ");

		assertEquals(Set.of("hello", "said", "the", "old", "man", "don't", "go"), tokens);
	}

	@Test
	public void testDuplicatesCollapse() {
		assertEquals(Set.of("to", "be", "or", "not"), Tokenizer.tokenize("To be, or not to be"));
	}

	@Test
	public void testEmptyInput() {
		assertTrue(Tokenizer.tokenize("").isEmpty());
		assertTrue(Tokenizer.tokenize("   ... --- ").isEmpty());
		assertTrue(Tokenizer.tokenize(null).isEmpty());
	}

	@Test
	public void testNonAsciiLetters() {
		assertEquals(Set.of("élan", "über", "42"), Tokenizer.tokenize("«Élan» Über 42."));
	}

	@Test
	public void testUnicodeWhitespaceSplits() {
		assertEquals(Set.of("foo", "bar", "baz"), Tokenizer.tokenize("foo\u00A0bar\u2003baz"));
	}

	@Test
	public void testNumericSymbolsAreKept() {
		assertEquals(Set.of("x²", "③", "½"), Tokenizer.tokenize("(x²) ③, ½."));
	}
}
