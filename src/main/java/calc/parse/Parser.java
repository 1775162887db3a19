package calc.parse;

import calc.ast.Span;
import calc.tokenize.OperationKind;
import calc.tokenize.SpecialKind;
import calc.tokenize.Token;
import calc.tokenize.TokenKind;
import calc.tokenize.TokenStream;
import calc.tokenize.Tokenizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Parser for calculator input lines.
 *
 * Expressions are parsed with a Pratt (precedence climbing) parser using one
 * token of lookahead. A parser is single-use.
 */
public final class Parser {
	private static final Logger LOG = LogManager.getLogger(Parser.class);

	private final Tokenizer tokenizer;

	public Parser(String input) {
		this.tokenizer = new Tokenizer(input);
	}

	/**
	 * Parse the whole line.
	 *
	 * @return the parse tree: an expression, a quit command, or empty
	 * @throws ParseException if the line is not a well-formed expression or command
	 */
	public ParseTree parse() throws ParseException {
		TokenStream tokens = tokenizer.tokenize();
		Token first = tokens.peek();
		if (first == null) {
			return new ParseTree.Empty();
		}
		if (first.kind() instanceof TokenKind.Special special) {
			if (special.special() == SpecialKind.QUIT) {
				return new ParseTree.Quit();
			}
			throw new ParseException(new ParserError.UnrecognizedSpecial(Optional.of(first.span())));
		}

		Expression expression = expression(tokens, 0);

		// the descent only stops early on a ')' nobody opened
		Token rest = tokens.peek();
		if (rest != null) {
			throw new ParseException(new ParserError.ExpectedBinaryOp(Optional.of(rest.span())));
		}
		LOG.debug("parsed {}", expression);
		return new ParseTree.ExpressionTree(expression);
	}

	private Expression expression(TokenStream tokens, int minBindingPower) throws ParseException {
		Expression left = operand(tokens);

		while (true) {
			Token t = tokens.peek();
			if (t == null || t.kind() instanceof TokenKind.CloseParenthesis) {
				break;
			}
			if (!(t.kind() instanceof TokenKind.Operation operation)) {
				throw new ParseException(new ParserError.ExpectedBinaryOp(Optional.of(t.span())));
			}

			BinaryOperation op = BinaryOperation.of(operation.operation());
			if (op.leftBindingPower() < minBindingPower) {
				break;
			}
			tokens.next();

			Expression right = expression(tokens, op.rightBindingPower());
			left = new Expression.Binary(op, left, right);
		}

		return left;
	}

	private Expression operand(TokenStream tokens) throws ParseException {
		Token t = tokens.nextOrNull();
		if (t == null) {
			throw new ParseException(new ParserError.ExpectedExprStart(Optional.empty()));
		}
		TokenKind kind = t.kind();

		if (kind instanceof TokenKind.Number number) {
			return new Expression.Atom(number.value());
		}

		if (isMinus(kind)) {
			// a run of prefix minuses shares one descent; each one still gets its own node
			int negations = 1;
			while (tokens.peek() != null && isMinus(tokens.peek().kind())) {
				tokens.next();
				negations++;
			}
			UnaryOperation op = UnaryOperation.NEGATION;
			Expression operand = expression(tokens, op.bindingPower());
			for (int i = 0; i < negations; i++) {
				operand = new Expression.Unary(op, operand);
			}
			return operand;
		}

		if (kind instanceof TokenKind.OpenParenthesis) {
			Expression inner = expression(tokens, 0);
			Token closing = tokens.nextOrNull();
			if (closing == null || !(closing.kind() instanceof TokenKind.CloseParenthesis)) {
				throw new ParseException(new ParserError.UnclosedParenthesis(spanOf(closing)));
			}
			return inner;
		}

		throw new ParseException(new ParserError.ExpectedExprStart(Optional.of(t.span())));
	}

	private static boolean isMinus(TokenKind kind) {
		return kind instanceof TokenKind.Operation operation && operation.operation() == OperationKind.MINUS;
	}

	private static Optional<Span> spanOf(Token token) {
		return token == null ? Optional.empty() : Optional.of(token.span());
	}
}
