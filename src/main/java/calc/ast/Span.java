package calc.ast;

/**
 * Source span for diagnostics.
 *
 * Offsets are 0-based, half-open indices into the original input line. They
 * always fall on code point boundaries, so a span can be passed straight to
 * {@link String#substring(int, int)}.
 */
public record Span(int start, int end) {
	public Span {
		if (start < 0 || end < start) {
			throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
		}
	}

	public String slice(String source) {
		if (end > source.length()) {
			throw new IllegalArgumentException(
					"span [" + start + ", " + end + ") out of bounds for length " + source.length());
		}
		return source.substring(start, end);
	}

	@Override
	public String toString() {
		return start + ".." + end;
	}
}
