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

import java.util.List;

import com.google.common.collect.ImmutableList;

import aspverify.core.Specification.Direction;
import aspverify.core.Syntax.Formula;

/**
 * A single obligation for a theorem prover: show that a conjecture follows
 * from a list of axioms.
 *
 * @author David J. Pearce
 *
 */
public class ProofProblem {
	private final String name;
	private final Direction direction;
	private final ImmutableList<Formula> axioms;
	private final Formula conjecture;

	public ProofProblem(String name, Direction direction, List<Formula> axioms, Formula conjecture) {
		this.name = name;
		this.direction = direction;
		this.axioms = ImmutableList.copyOf(axioms);
		this.conjecture = conjecture;
	}

	public String name() {
		return name;
	}

	public Direction direction() {
		return direction;
	}

	public ImmutableList<Formula> axioms() {
		return axioms;
	}

	public Formula conjecture() {
		return conjecture;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof ProofProblem) {
			ProofProblem p = (ProofProblem) o;
			return name.equals(p.name) && direction == p.direction && axioms.equals(p.axioms)
					&& conjecture.equals(p.conjecture);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return name.hashCode() ^ axioms.hashCode() ^ conjecture.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder r = new StringBuilder();
		r.append("problem ").append(name).append(" (").append(direction).append(")\n");
		for (Formula f : axioms) {
			r.append("  axiom: ").append(f).append("\n");
		}
		r.append("  conjecture: ").append(conjecture).append("\n");
		return r.toString();
	}
}
