package calc.parse;

public enum UnaryOperation {
	NEGATION("-", 5);

	private final String symbol;
	private final int bindingPower;

	UnaryOperation(String symbol, int bindingPower) {
		this.symbol = symbol;
		this.bindingPower = bindingPower;
	}

	public String symbol() {
		return symbol;
	}

	int bindingPower() {
		return bindingPower;
	}
}
