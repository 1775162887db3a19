package calc.parse;

import calc.ast.Span;

import java.util.Optional;

/**
 * An error caught by the parser.
 *
 * The span points at the offending token, and is empty when the parser ran out
 * of input instead.
 */
public sealed interface ParserError permits ParserError.UnrecognizedSpecial, ParserError.ExpectedBinaryOp,
		ParserError.ExpectedExprStart, ParserError.UnclosedParenthesis {

	Optional<Span> span();

	/** A {@code ?} command other than {@code ?quit}. */
	record UnrecognizedSpecial(Optional<Span> span) implements ParserError {}

	/** Expected one of {@code + - * /} but got something else. */
	record ExpectedBinaryOp(Optional<Span> span) implements ParserError {}

	/** Expected {@code -}, {@code (} or a number but got something else. */
	record ExpectedExprStart(Optional<Span> span) implements ParserError {}

	/** Expected a closing parenthesis but got something else. */
	record UnclosedParenthesis(Optional<Span> span) implements ParserError {}
}
