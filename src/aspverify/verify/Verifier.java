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

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.google.common.collect.ImmutableList;

import aspverify.core.Syntax.Formula;

/**
 * Discharges proof schedules using a given prover. Each direction is driven
 * independently, whilst at most a fixed number of prover instances run at any
 * one time. The stages of a direction are attempted in order, with the
 * problems of a stage attempted in parallel. If any problem of a stage is not
 * proved then the remaining stages of that direction are skipped.
 *
 * @author David J. Pearce
 *
 */
public class Verifier {
	/**
	 * Construct a thread pool to use for driving directions.
	 */
	private static final ExecutorService executor = Executors.newCachedThreadPool();

	private final Prover prover;

	/**
	 * Maximum number of prover instances running at once.
	 */
	private int instances = 1;

	/**
	 * Time limit (in seconds) for each problem.
	 */
	private int timeLimit = 60;

	/**
	 * Flag whether to report progress or not.
	 */
	private boolean verbose = false;

	/**
	 * Default output stream for progress.
	 */
	private PrintStream out = System.err;

	public Verifier(Prover prover) {
		this.prover = prover;
	}

	public Verifier setInstances(int instances) {
		this.instances = instances;
		return this;
	}

	public Verifier setTimeLimit(int timeLimit) {
		this.timeLimit = timeLimit;
		return this;
	}

	public Verifier setVerbose(boolean verbose) {
		this.verbose = verbose;
		return this;
	}

	public Verifier setOutput(PrintStream out) {
		this.out = out;
		return this;
	}

	/**
	 * Attempt every problem of the given schedules.
	 *
	 * @param schedules
	 * @return
	 * @throws InterruptedException
	 */
	public Report verify(List<ProofSchedule> schedules) throws InterruptedException {
		final ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, instances));
		try {
			ArrayList<Future<List<Result>>> drivers = new ArrayList<>();
			for (ProofSchedule schedule : schedules) {
				drivers.add(executor.submit(() -> drive(schedule, pool)));
			}
			ArrayList<Result> results = new ArrayList<>();
			for (Future<List<Result>> driver : drivers) {
				results.addAll(driver.get());
			}
			return new Report(results);
		} catch (ExecutionException e) {
			throw new IllegalStateException(e.getCause());
		} finally {
			pool.shutdownNow();
		}
	}

	/**
	 * Drive the stages of a single direction.
	 */
	private List<Result> drive(ProofSchedule schedule, ExecutorService pool)
			throws InterruptedException, ExecutionException {
		ArrayList<Result> results = new ArrayList<>();
		boolean proved = true;
		for (List<ProofProblem> stage : schedule.stages()) {
			if (!proved) {
				for (ProofProblem p : stage) {
					results.add(new Result(p, Status.SKIPPED, 0));
					report(p, Status.SKIPPED, 0);
				}
				continue;
			}
			ArrayList<Future<Result>> attempts = new ArrayList<>();
			for (ProofProblem p : stage) {
				attempts.add(pool.submit(() -> attempt(p)));
			}
			for (Future<Result> attempt : attempts) {
				Result r = attempt.get();
				results.add(r);
				proved &= r.status().isSuccess();
			}
		}
		return results;
	}

	private Result attempt(ProofProblem problem) {
		long start = System.currentTimeMillis();
		Status status;
		try {
			status = prover.prove(problem, timeLimit);
		} catch (IOException e) {
			out.println("error running prover on " + problem.name() + ": " + e.getMessage());
			status = Status.ERROR;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			status = Status.ERROR;
		}
		long time = System.currentTimeMillis() - start;
		report(problem, status, time);
		return new Result(problem, status, time);
	}

	/**
	 * Report the outcome of a single problem.
	 */
	private void report(ProofProblem problem, Status status, long time) {
		if (verbose) {
			synchronized (out) {
				out.println("[" + problem.direction() + "] " + problem.name() + " ... " + status + " ("
						+ String.format("%.2f", time / 1000.0) + "s)");
			}
		}
	}

	/**
	 * The outcome of a single proof problem.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Result {
		private final ProofProblem problem;
		private final Status status;
		private final long time;

		public Result(ProofProblem problem, Status status, long time) {
			this.problem = problem;
			this.status = status;
			this.time = time;
		}

		public ProofProblem problem() {
			return problem;
		}

		public Status status() {
			return status;
		}

		/**
		 * Time taken in milliseconds.
		 *
		 * @return
		 */
		public long time() {
			return time;
		}
	}

	/**
	 * The outcome of a complete verification.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Report {
		private final ImmutableList<Result> results;

		public Report(List<Result> results) {
			this.results = ImmutableList.copyOf(results);
		}

		public ImmutableList<Result> results() {
			return results;
		}

		/**
		 * Verification succeeds only if every problem is a theorem.
		 *
		 * @return
		 */
		public boolean isSuccess() {
			for (Result r : results) {
				if (!r.status().isSuccess()) {
					return false;
				}
			}
			return true;
		}

		public List<Result> failures() {
			ArrayList<Result> failures = new ArrayList<>();
			for (Result r : results) {
				if (!r.status().isSuccess()) {
					failures.add(r);
				}
			}
			return failures;
		}

		/**
		 * Print a summary of the outcome, listing the axioms and conjecture of
		 * the first problem which was attempted but not proved.
		 *
		 * @param out
		 */
		public void print(PrintStream out) {
			for (Result r : results) {
				out.println("[" + r.problem().direction() + "] " + r.problem().name() + ": " + r.status());
			}
			for (Result r : failures()) {
				if (r.status() != Status.SKIPPED) {
					out.println();
					out.println("Failed to prove " + r.problem().name() + " (" + r.status() + ")");
					for (Formula f : r.problem().axioms()) {
						out.println("  axiom: " + f);
					}
					out.println("  conjecture: " + r.problem().conjecture());
					break;
				}
			}
			out.println();
			out.println(isSuccess() ? "Success! Equivalence verified." : "Failure! Equivalence not verified.");
		}
	}
}
