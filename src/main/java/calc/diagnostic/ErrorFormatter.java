package calc.diagnostic;

import calc.ast.Span;
import calc.parse.ParserError;

/**
 * Turns parser errors into human-readable diagnostics.
 *
 * A diagnostic is an explanation line followed by the source line and a caret
 * underline below the offending text:
 *
 * <pre>
 * error: expected `)`, found `&lt;EOL&gt;`
 *       (1+2
 *          ^
 * </pre>
 */
public final class ErrorFormatter {
	/** Stand-in for the offending text when the parser ran out of input. */
	public static final String END_OF_LINE = "<EOL>";

	private static final String INDENT = "      ";

	private ErrorFormatter() {
		// utility class
	}

	public static String format(ParserError error, String input) {
		String line = stripLineTerminator(input);
		String message = explain(error, line);
		Span span = error.span().orElseGet(() -> lastCharacter(line));

		String padding = " ".repeat(codePoints(line.substring(0, span.start())));
		String underline = "^".repeat(codePoints(span.slice(line)));

		return "error: " + message + "\n"
				+ INDENT + line + "\n"
				+ INDENT + padding + underline;
	}

	static String explain(ParserError error, String line) {
		String found = error.span().map(s -> s.slice(line)).orElse(END_OF_LINE);
		if (error instanceof ParserError.UnrecognizedSpecial) {
			return "expected `?quit`, found `" + found + "`";
		}
		if (error instanceof ParserError.ExpectedBinaryOp) {
			return "expected one of `+`, `-`, `*`, `/`, found `" + found + "`";
		}
		if (error instanceof ParserError.ExpectedExprStart) {
			return "expected one of `-`, `(`, or a number, found `" + found + "`";
		}
		if (error instanceof ParserError.UnclosedParenthesis) {
			return "expected `)`, found `" + found + "`";
		}
		throw new IllegalArgumentException("unknown parser error " + error);
	}

	/**
	 * Span of the last code point, used to anchor errors at end of input.
	 */
	static Span lastCharacter(String line) {
		if (line.isEmpty()) {
			return new Span(0, 0);
		}
		return new Span(line.offsetByCodePoints(line.length(), -1), line.length());
	}

	// spans never cover the terminator since it is trailing whitespace
	private static String stripLineTerminator(String input) {
		int end = input.length();
		while (end > 0 && (input.charAt(end - 1) == '\n' || input.charAt(end - 1) == '\r')) {
			end--;
		}
		return input.substring(0, end);
	}

	private static int codePoints(String s) {
		return s.codePointCount(0, s.length());
	}
}
