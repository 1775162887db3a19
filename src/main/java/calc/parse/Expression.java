package calc.parse;

/**
 * Arithmetic expression. The root of the syntax tree.
 *
 * Every node exclusively owns its children.
 */
public sealed interface Expression permits Expression.Binary, Expression.Unary, Expression.Atom {

	record Binary(BinaryOperation operation, Expression left, Expression right) implements Expression {
		@Override
		public String toString() {
			return "(" + left + " " + operation.symbol() + " " + right + ")";
		}
	}

	record Unary(UnaryOperation operation, Expression operand) implements Expression {
		@Override
		public String toString() {
			return "(" + operation.symbol() + operand + ")";
		}
	}

	/** A number. */
	record Atom(double value) implements Expression {
		@Override
		public String toString() {
			return Double.toString(value);
		}
	}
}
