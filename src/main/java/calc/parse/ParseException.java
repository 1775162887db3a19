package calc.parse;

/**
 * Thrown when an input line cannot be parsed. Always caused by the user's
 * input, never by an internal fault.
 */
public class ParseException extends Exception {
	private final ParserError error;

	public ParseException(ParserError error) {
		super(describe(error));
		this.error = error;
	}

	public ParserError getError() {
		return error;
	}

	private static String describe(ParserError error) {
		return error.getClass().getSimpleName() + " at " + error.span().map(Object::toString).orElse("end of input");
	}
}
