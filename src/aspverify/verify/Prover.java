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

/**
 * An automated theorem prover capable of discharging proof problems.
 *
 * @author David J. Pearce
 *
 */
public interface Prover {
	/**
	 * Attempt to prove the conjecture of a problem from its axioms.
	 *
	 * @param problem
	 * @param timeLimit
	 *            Time limit in seconds.
	 * @return
	 * @throws IOException
	 * @throws InterruptedException
	 */
	public Status prove(ProofProblem problem, int timeLimit) throws IOException, InterruptedException;
}
