package calc.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SpanTest {
	@Test
	void slicesTheSpannedText() {
		assertEquals("2*3", new Span(2, 5).slice("1+2*3"));
	}

	@Test
	void emptySpanSlicesToEmptyString() {
		assertEquals("", new Span(3, 3).slice("abc"));
	}

	@Test
	void rejectsInvertedBounds() {
		assertThrows(IllegalArgumentException.class, () -> new Span(4, 2));
		assertThrows(IllegalArgumentException.class, () -> new Span(-1, 2));
	}

	@Test
	void rejectsSliceBeyondSource() {
		assertThrows(IllegalArgumentException.class, () -> new Span(0, 4).slice("abc"));
	}
}
