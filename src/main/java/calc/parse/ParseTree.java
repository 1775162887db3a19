package calc.parse;

/**
 * Result of parsing one input line.
 */
public sealed interface ParseTree permits ParseTree.ExpressionTree, ParseTree.Quit, ParseTree.Empty {

	/** A parsed arithmetic expression. */
	record ExpressionTree(Expression expression) implements ParseTree {}

	/** The {@code ?quit} command. */
	record Quit() implements ParseTree {}

	/** Nothing to parse. */
	record Empty() implements ParseTree {}
}
