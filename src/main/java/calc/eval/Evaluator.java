package calc.eval;

import calc.parse.Expression;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Reduces expression trees to numbers.
 */
public final class Evaluator {

	private Evaluator() {
		// utility class
	}

	/**
	 * Recursively evaluate an expression. Division by zero follows IEEE-754 and
	 * yields an infinity or NaN.
	 */
	public static double evaluate(Expression expression) {
		if (expression instanceof Expression.Binary binary) {
			return evaluateBinary(binary);
		}
		if (expression instanceof Expression.Unary unary) {
			return evaluateUnary(unary);
		}
		if (expression instanceof Expression.Atom atom) {
			return atom.value();
		}
		throw new IllegalArgumentException("node cannot be null");
	}

	// nested negations are unwound in a loop so long chains like "----1" do not
	// grow the stack
	private static double evaluateUnary(Expression.Unary unary) {
		boolean negate = false;
		Expression node = unary;
		while (node instanceof Expression.Unary u) {
			switch (u.operation()) {
				case NEGATION:
					negate = !negate;
					break;
				default:
					throw new IllegalArgumentException("unknown operation " + u.operation());
			}
			node = u.operand();
		}
		double value = evaluate(node);
		return negate ? -value : value;
	}

	private static double evaluateBinary(Expression.Binary binary) {
		double left = evaluate(binary.left());
		double right = evaluate(binary.right());
		switch (binary.operation()) {
			case ADDITION:
				return left + right;
			case SUBTRACTION:
				return left - right;
			case MULTIPLICATION:
				return left * right;
			case DIVISION:
				return left / right;
			default:
				throw new IllegalArgumentException("unknown operation " + binary.operation());
		}
	}

	/**
	 * Render a result the way the calculator prints it: shortest round-trip
	 * decimal, no exponent, no trailing {@code .0}.
	 */
	public static String display(double value) {
		if (Double.isNaN(value)) {
			return "NaN";
		}
		if (Double.isInfinite(value)) {
			return value > 0 ? "inf" : "-inf";
		}
		if (value == 0.0) {
			// BigDecimal has no negative zero
			return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
		}
		return shortest(value).stripTrailingZeros().toPlainString();
	}

	/**
	 * Fewest significant digits that still read back as the same double.
	 * {@code Double.toString} is not always minimal before JDK 19.
	 */
	private static BigDecimal shortest(double value) {
		BigDecimal exact = new BigDecimal(value);
		for (int precision = 1; precision < 17; precision++) {
			BigDecimal rounded = exact.round(new MathContext(precision));
			if (rounded.doubleValue() == value) {
				return rounded;
			}
		}
		return exact.round(new MathContext(17));
	}
}
