package calc.repl;

import calc.diagnostic.ErrorFormatter;
import calc.eval.Evaluator;
import calc.parse.ParseException;
import calc.parse.ParseTree;
import calc.parse.Parser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Read-eval-print loop of the calculator.
 *
 * Each line is parsed independently; nothing carries over between lines.
 */
public final class Repl {
	private static final Logger LOG = LogManager.getLogger(Repl.class);

	public static final String PROMPT = "calc❯ ";

	/** What the loop does after a line has been handled. */
	public enum Step {
		CONTINUE,
		QUIT
	}

	private final BufferedReader in;
	private final PrintStream out;

	public Repl(BufferedReader in, PrintStream out) {
		this.in = in;
		this.out = out;
	}

	/**
	 * Prompt for lines until {@code ?quit} or end of input.
	 *
	 * @return the number of lines handled
	 * @throws IOException if reading the input fails
	 */
	public int run() throws IOException {
		int handled = 0;
		while (true) {
			out.print(PROMPT);
			out.flush();
			String line = in.readLine();
			if (line == null) {
				out.println();
				LOG.info("end of input after {} lines", handled);
				return handled;
			}
			handled++;
			if (handle(line) == Step.QUIT) {
				LOG.info("quit after {} lines", handled);
				return handled;
			}
		}
	}

	/**
	 * Evaluate one line and print its result or diagnostic.
	 */
	public Step handle(String line) {
		ParseTree tree;
		try {
			tree = new Parser(line).parse();
		} catch (ParseException e) {
			LOG.debug("rejected input {}: {}", line, e.getMessage());
			out.println(ErrorFormatter.format(e.getError(), line));
			return Step.CONTINUE;
		}

		if (tree instanceof ParseTree.Quit) {
			return Step.QUIT;
		}
		if (tree instanceof ParseTree.ExpressionTree expressionTree) {
			double result = Evaluator.evaluate(expressionTree.expression());
			out.println(Evaluator.display(result));
		}
		return Step.CONTINUE;
	}
}
