package calc.tokenize;

public enum SpecialKind {
	QUIT,
	UNRECOGNIZED
}
