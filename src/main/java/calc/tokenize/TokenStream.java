package calc.tokenize;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Whitespace-free token sequence with one token of lookahead.
 *
 * Tokens are pulled from the tokenizer on demand.
 */
public final class TokenStream implements Iterator<Token> {
	private final Tokenizer tokenizer;
	private Token lookahead;
	private boolean exhausted;

	TokenStream(Tokenizer tokenizer) {
		this.tokenizer = tokenizer;
	}

	/**
	 * Returns the next token without consuming it, or null at end of input.
	 */
	public Token peek() {
		if (lookahead == null && !exhausted) {
			lookahead = pull();
			exhausted = lookahead == null;
		}
		return lookahead;
	}

	@Override
	public boolean hasNext() {
		return peek() != null;
	}

	@Override
	public Token next() {
		Token t = peek();
		if (t == null) {
			throw new NoSuchElementException("end of input");
		}
		lookahead = null;
		return t;
	}

	/**
	 * Consumes the next token, returning null at end of input.
	 */
	public Token nextOrNull() {
		return hasNext() ? next() : null;
	}

	private Token pull() {
		Token t = tokenizer.nextToken();
		while (t != null && t.kind() instanceof TokenKind.Whitespace) {
			t = tokenizer.nextToken();
		}
		return t;
	}
}
