package calc;

import calc.repl.Repl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

public class App {
	public static void main(String[] args) {
		BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
		PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
		try {
			new Repl(in, out).run();
		} catch (IOException e) {
			System.err.println("failed to read from standard input: " + e.getMessage());
			System.exit(1);
		}
	}
}
