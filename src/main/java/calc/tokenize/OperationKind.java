package calc.tokenize;

public enum OperationKind {
	PLUS('+'),
	MINUS('-'),
	STAR('*'),
	SLASH('/');

	private final char symbol;

	OperationKind(char symbol) {
		this.symbol = symbol;
	}

	public char symbol() {
		return symbol;
	}

	/**
	 * Returns the operation spelled by the given code point, or null.
	 */
	static OperationKind fromSymbol(int c) {
		for (OperationKind kind : values()) {
			if (kind.symbol == c) {
				return kind;
			}
		}
		return null;
	}
}
