package calc.parse;

import calc.eval.Evaluator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Runs the parser over every short line built from a small alphabet.
 */
public class ParserEnumerationTest {
	private static final char[] ALPHABET = { '1', '+', '-', '*', '/', '(', ')', '?', 'x', ' ' };
	private static final int MAX_LENGTH = 5;

	@Test
	void everyLineParsesOrFailsWithParseException() {
		int parsed = 0;
		int rejected = 0;
		for (String line : lines()) {
			try {
				ParseTree tree = new Parser(line).parse();
				if (tree instanceof ParseTree.ExpressionTree expressionTree) {
					Evaluator.evaluate(expressionTree.expression());
					assertBalanced(line);
				}
				parsed++;
			} catch (ParseException e) {
				e.getError().span().ifPresent(span -> assertTrue(span.end() <= line.length(), line));
				rejected++;
			} catch (RuntimeException e) {
				fail("unexpected " + e + " for input '" + line + "'");
			}
		}
		assertTrue(parsed > 0);
		assertTrue(rejected > 0);
	}

	@Test
	void parsingIsDeterministic() throws ParseException {
		for (String line : lines()) {
			ParseTree first;
			try {
				first = new Parser(line).parse();
			} catch (ParseException e) {
				ParseException again = assertThrows(ParseException.class, () -> new Parser(line).parse());
				assertEquals(e.getError(), again.getError(), line);
				continue;
			}
			assertEquals(first, new Parser(line).parse(), line);
		}
	}

	// every accepted expression has matched parentheses, stray ')' included
	private static void assertBalanced(String line) {
		int depth = 0;
		for (char c : line.toCharArray()) {
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth--;
				assertTrue(depth >= 0, line);
			}
		}
		assertEquals(0, depth, line);
	}

	private static List<String> lines() {
		List<String> lines = new ArrayList<>();
		lines.add("");
		List<String> previous = List.of("");
		for (int length = 1; length <= MAX_LENGTH; length++) {
			List<String> current = new ArrayList<>();
			for (String prefix : previous) {
				for (char c : ALPHABET) {
					current.add(prefix + c);
				}
			}
			lines.addAll(current);
			previous = current;
		}
		return lines;
	}
}
