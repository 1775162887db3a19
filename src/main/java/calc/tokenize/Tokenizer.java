package calc.tokenize;

import calc.ast.Span;
import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Lexical analyzer for calculator input lines.
 *
 * A tokenizer is single-use: {@link #nextToken()} and {@link #tokenize()} share
 * one cursor. To read the same line again, create a new tokenizer.
 */
public final class Tokenizer {
	private static final Logger LOG = LogManager.getLogger(Tokenizer.class);

	private static final String QUIT = "quit";

	private final String input;
	private final Cursor cursor;

	public Tokenizer(String input) {
		this.input = Objects.requireNonNull(input, "input");
		this.cursor = new Cursor(input);
	}

	/**
	 * Returns a lazy stream over the remaining tokens, whitespace excluded.
	 */
	public TokenStream tokenize() {
		return new TokenStream(this);
	}

	/**
	 * Reads the next raw token, whitespace included.
	 *
	 * @return the token, or null once every character has been consumed
	 */
	public Token nextToken() {
		int start = cursor.position();
		int c = cursor.advance();
		if (c == Cursor.EOF) {
			return null;
		}

		TokenKind kind;
		if (UCharacter.isUWhiteSpace(c)) {
			cursor.skipWhile(UCharacter::isUWhiteSpace);
			kind = new TokenKind.Whitespace();
		} else if (c == '?') {
			kind = special(start);
		} else if (isAsciiDigit(c)) {
			kind = number(start);
		} else if (c == '(') {
			kind = new TokenKind.OpenParenthesis();
		} else if (c == ')') {
			kind = new TokenKind.CloseParenthesis();
		} else {
			OperationKind op = OperationKind.fromSymbol(c);
			kind = op != null ? new TokenKind.Operation(op) : new TokenKind.Unrecognized();
		}

		Token token = new Token(kind, new Span(start, cursor.position()));
		LOG.trace("token {} at {}", kind, token.span());
		return token;
	}

	private TokenKind special(int start) {
		cursor.skipWhile(c -> UCharacter.hasBinaryProperty(c, UProperty.XID_CONTINUE));
		// the identifier excludes the leading '?'
		String identifier = input.substring(start + 1, cursor.position());
		if (QUIT.equals(identifier)) {
			return new TokenKind.Special(SpecialKind.QUIT);
		}
		return new TokenKind.Special(SpecialKind.UNRECOGNIZED);
	}

	private TokenKind number(int start) {
		cursor.skipWhile(Tokenizer::isAsciiDigit);
		if (cursor.peek() == '.') {
			cursor.advance();
			cursor.skipWhile(Tokenizer::isAsciiDigit);
		}
		// digits with an optional fraction (possibly empty) always parse
		String text = input.substring(start, cursor.position());
		return new TokenKind.Number(Double.parseDouble(text));
	}

	private static boolean isAsciiDigit(int c) {
		return c >= '0' && c <= '9';
	}
}
