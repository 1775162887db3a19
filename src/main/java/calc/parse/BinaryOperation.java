package calc.parse;

import calc.tokenize.OperationKind;

public enum BinaryOperation {
	ADDITION("+", 1, 2),
	SUBTRACTION("-", 1, 2),
	MULTIPLICATION("*", 3, 4),
	DIVISION("/", 3, 4);

	private final String symbol;
	private final int leftBindingPower;
	private final int rightBindingPower;

	BinaryOperation(String symbol, int leftBindingPower, int rightBindingPower) {
		this.symbol = symbol;
		this.leftBindingPower = leftBindingPower;
		this.rightBindingPower = rightBindingPower;
	}

	public String symbol() {
		return symbol;
	}

	/**
	 * Binding power towards the left operand. Compared against the minimum
	 * binding power of the enclosing descent.
	 */
	int leftBindingPower() {
		return leftBindingPower;
	}

	/**
	 * Minimum binding power for the right operand. Always greater than the left
	 * one, which makes the operator left-associative.
	 */
	int rightBindingPower() {
		return rightBindingPower;
	}

	static BinaryOperation of(OperationKind kind) {
		switch (kind) {
			case PLUS:
				return ADDITION;
			case MINUS:
				return SUBTRACTION;
			case STAR:
				return MULTIPLICATION;
			case SLASH:
				return DIVISION;
			default:
				throw new IllegalArgumentException("unknown operation " + kind);
		}
	}
}
