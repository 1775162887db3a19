package calc.tokenize;

/**
 * The kind of a token.
 */
public sealed interface TokenKind permits TokenKind.Whitespace, TokenKind.Special, TokenKind.Number,
		TokenKind.Operation, TokenKind.OpenParenthesis, TokenKind.CloseParenthesis, TokenKind.Unrecognized {

	/** A run of whitespace. Never reaches the parser. */
	record Whitespace() implements TokenKind {}

	/** A {@code ?}-prefixed command such as {@code ?quit}. */
	record Special(SpecialKind special) implements TokenKind {}

	/** A numeric literal. All numbers are doubles. */
	record Number(double value) implements TokenKind {}

	/** One of {@code + - * /}. */
	record Operation(OperationKind operation) implements TokenKind {}

	record OpenParenthesis() implements TokenKind {}

	record CloseParenthesis() implements TokenKind {}

	/** A single character that starts no known token. */
	record Unrecognized() implements TokenKind {}
}
