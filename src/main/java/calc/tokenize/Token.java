package calc.tokenize;

import calc.ast.Span;

public record Token(TokenKind kind, Span span) {
}
