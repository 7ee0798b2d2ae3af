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

/**
 * The outcome of attempting to discharge a single proof problem. These follow
 * the SZS ontology used by first-order provers, plus {@link #SKIPPED} for
 * problems which were never attempted.
 *
 * @author David J. Pearce
 *
 */
public enum Status {
	THEOREM("Theorem"),
	COUNTER_SATISFIABLE("CounterSatisfiable"),
	CONTRADICTORY_AXIOMS("ContradictoryAxioms"),
	UNKNOWN("Unknown"),
	TIMEOUT("Timeout"),
	ERROR("Error"),
	SKIPPED("Skipped");

	private final String szs;

	private Status(String szs) {
		this.szs = szs;
	}

	/**
	 * Check whether this outcome establishes the conjecture. Contradictory
	 * axioms prove anything, and hence are not counted as success.
	 *
	 * @return
	 */
	public boolean isSuccess() {
		return this == THEOREM;
	}

	/**
	 * Map an SZS status name (e.g. <code>Theorem</code>) onto a status.
	 * Unrecognised names are reported as {@link #UNKNOWN}.
	 *
	 * @param name
	 * @return
	 */
	public static Status fromSZS(String name) {
		for (Status s : values()) {
			if (s.szs.equals(name)) {
				return s;
			}
		}
		switch (name) {
		case "Unsatisfiable":
			// a conjecture-free problem whose axioms are unsatisfiable
			return CONTRADICTORY_AXIOMS;
		case "TimeLimit":
			return TIMEOUT;
		case "GaveUp":
		case "Satisfiable":
		default:
			return UNKNOWN;
		}
	}

	@Override
	public String toString() {
		return szs;
	}
}
