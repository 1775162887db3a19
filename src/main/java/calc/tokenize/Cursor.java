package calc.tokenize;

import java.util.function.IntPredicate;

/**
 * A cursor over the code points of an input line.
 *
 * The cursor records the offset of the next unread code point so the tokenizer
 * can give every token a span. Supplementary characters advance the offset by
 * two.
 */
final class Cursor {
	static final int EOF = -1;

	private final String input;
	private int position;

	Cursor(String input) {
		this.input = input;
		this.position = 0;
	}

	int position() {
		return position;
	}

	/**
	 * Returns the next code point without consuming it, or {@link #EOF}.
	 */
	int peek() {
		if (position >= input.length()) {
			return EOF;
		}
		return input.codePointAt(position);
	}

	/**
	 * Consumes the next code point and returns it, or {@link #EOF} when the input
	 * is exhausted.
	 */
	int advance() {
		int c = peek();
		if (c != EOF) {
			position += Character.charCount(c);
		}
		return c;
	}

	void skipWhile(IntPredicate predicate) {
		while (peek() != EOF && predicate.test(peek())) {
			advance();
		}
	}
}
