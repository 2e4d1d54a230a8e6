package org.bucketindex.core.source;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns free text into the set of normalized tokens used by both indexing and querying.
 */
public final class Tokenizer {
	private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

	private Tokenizer() {}

	/**
	 * Split on Unicode whitespace, trim non-alphanumeric characters from both ends of each word, drop empty
	 * words and lower-case the rest. Inner punctuation is kept ({@code "don't"} stays one token).
	 */
	public static Set<String> tokenize(String text) {
		Set<String> tokens = new HashSet<>();
		if (text == null) {
			return tokens;
		}

		for (String word : WHITESPACE.split(text)) {
			String trimmed = trim(word);
			if (!trimmed.isEmpty()) {
				tokens.add(trimmed.toLowerCase(Locale.ROOT));
			}
		}
		return tokens;
	}

	private static String trim(String word) {
		int start = 0;
		int end = word.length();
		while (start < end) {
			int cp = word.codePointAt(start);
			if (isAlphanumeric(cp)) break;
			start += Character.charCount(cp);
		}
		while (end > start) {
			int cp = word.codePointBefore(end);
			if (isAlphanumeric(cp)) break;
			end -= Character.charCount(cp);
		}
		return word.substring(start, end);
	}

	private static boolean isAlphanumeric(int cp) {
		if (Character.isAlphabetic(cp)) {
			return true;
		}
		int type = Character.getType(cp);
		return type == Character.DECIMAL_DIGIT_NUMBER
				|| type == Character.LETTER_NUMBER
				|| type == Character.OTHER_NUMBER;
	}
}
