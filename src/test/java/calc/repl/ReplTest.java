package calc.repl;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ReplTest {
	@Test
	void printsResultsUntilQuit() throws IOException {
		Transcript t = run("1+2*3\n(1+2)*3\n?quit\n4\n");
		assertEquals(3, t.handled);
		assertEquals(Repl.PROMPT + "7\n" + Repl.PROMPT + "9\n" + Repl.PROMPT, t.output);
	}

	@Test
	void emptyLinesPrintNothing() throws IOException {
		Transcript t = run("\n   \n?quit\n");
		assertEquals(Repl.PROMPT + Repl.PROMPT + Repl.PROMPT, t.output);
	}

	@Test
	void errorsAreReportedAndTheLoopContinues() throws IOException {
		Transcript t = run("(1+2\n8/4/2\n?quit\n");
		assertEquals(Repl.PROMPT
				+ "error: expected `)`, found `<EOL>`\n"
				+ "      (1+2\n"
				+ "         ^\n"
				+ Repl.PROMPT + "1\n"
				+ Repl.PROMPT, t.output);
	}

	@Test
	void endOfInputStopsTheLoop() throws IOException {
		Transcript t = run("1/0\n-1/0");
		assertEquals(2, t.handled);
		assertEquals(Repl.PROMPT + "inf\n" + Repl.PROMPT + "-inf\n" + Repl.PROMPT + "\n", t.output);
	}

	@Test
	void handleReportsQuit() {
		Repl repl = new Repl(new BufferedReader(new StringReader("")), new PrintStream(new ByteArrayOutputStream()));
		assertEquals(Repl.Step.QUIT, repl.handle("?quit please"));
		assertEquals(Repl.Step.CONTINUE, repl.handle("?please"));
		assertEquals(Repl.Step.CONTINUE, repl.handle("1"));
	}

	private static Transcript run(String input) throws IOException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
		int handled = new Repl(new BufferedReader(new StringReader(input)), out).run();
		String output = bytes.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
		return new Transcript(handled, output);
	}

	private record Transcript(int handled, String output) {
	}
}
