// This file is part of the ASP Verifier (aspverify).
//
// The ASP Verifier is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The ASP Verifier is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the ASP Verifier. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package aspverify.verify;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import aspverify.io.TptpPrinter;

/**
 * A simplistic Java binding to the Vampire theorem prover. Each problem is
 * written to a temporary file, and the outcome is read from the SZS status
 * line which Vampire prints.
 *
 * @author David J. Pearce
 *
 */
public final class Vampire implements Prover {
	private static final boolean DEBUG = false;
	private static final Pattern SZS = Pattern.compile("% SZS status (\\w+) for");
	/**
	 * Time allowed beyond the prover's own limit before it is killed.
	 */
	private static final long GRACE = 5000;

	private final List<String> vampire_cmd;
	private final int cores;

	public Vampire(String vampire_cmd, int cores) {
		this.vampire_cmd = Arrays.asList(vampire_cmd.trim().split("\\s+"));
		this.cores = cores;
	}

	@Override
	public Status prove(ProofProblem problem, int timeLimit) throws IOException, InterruptedException {
		File input = File.createTempFile("aspverify", ".p");
		File output = File.createTempFile("aspverify", ".out");
		try {
			try (PrintStream out = new PrintStream(input, StandardCharsets.UTF_8.name())) {
				new TptpPrinter(out).print(problem);
			}
			// ===================================================
			// Construct command
			// ===================================================
			ArrayList<String> command = new ArrayList<>(vampire_cmd);
			command.add("--mode");
			command.add("casc");
			command.add("--cores");
			command.add(Integer.toString(cores));
			command.add("--time_limit");
			command.add(Integer.toString(timeLimit));
			command.add("--proof");
			command.add("off");
			command.add(input.getAbsolutePath());
			if (exec(command, output, timeLimit * 1000L + GRACE)) {
				return parse(new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8));
			} else {
				return Status.TIMEOUT;
			}
		} finally {
			input.delete();
			output.delete();
		}
	}

	/**
	 * Extract the outcome from the output of Vampire.
	 *
	 * @param output
	 * @return
	 */
	public static Status parse(String output) {
		Matcher m = SZS.matcher(output);
		if (m.find()) {
			return Status.fromSZS(m.group(1));
		}
		if (DEBUG) {
			System.err.println(output);
		}
		return Status.ERROR;
	}

	/**
	 * Run a command to completion, redirecting its output into a given file.
	 *
	 * @return false if the command did not complete in time.
	 */
	private static boolean exec(List<String> cmd, File output, long timeout) throws IOException, InterruptedException {
		// ===================================================
		// Execute Process
		// ===================================================
		ProcessBuilder builder = new ProcessBuilder(cmd);
		builder.redirectErrorStream(true);
		builder.redirectOutput(output);
		Process child = builder.start();
		try {
			return child.waitFor(timeout, TimeUnit.MILLISECONDS);
		} finally {
			// make sure child process is destroyed.
			child.destroy();
		}
	}
}
