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

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import aspverify.core.Specification.Direction;

/**
 * The proof problems for one direction of an equivalence claim, arranged into
 * stages. Problems within a stage are independent of each other and may be
 * attempted in parallel, whilst a stage may only be attempted once every
 * earlier stage has been proved.
 *
 * @author David J. Pearce
 *
 */
public class ProofSchedule {
	private final Direction direction;
	private final ImmutableList<ImmutableList<ProofProblem>> stages;

	public ProofSchedule(Direction direction, List<? extends List<ProofProblem>> stages) {
		this.direction = direction;
		ImmutableList.Builder<ImmutableList<ProofProblem>> builder = ImmutableList.builder();
		for (List<ProofProblem> stage : stages) {
			if (!stage.isEmpty()) {
				builder.add(ImmutableList.copyOf(stage));
			}
		}
		this.stages = builder.build();
	}

	public Direction direction() {
		return direction;
	}

	public ImmutableList<ImmutableList<ProofProblem>> stages() {
		return stages;
	}

	/**
	 * Get every problem in this schedule, in order.
	 *
	 * @return
	 */
	public List<ProofProblem> problems() {
		ArrayList<ProofProblem> result = new ArrayList<>();
		for (List<ProofProblem> stage : stages) {
			result.addAll(stage);
		}
		return result;
	}

	@Override
	public String toString() {
		StringBuilder r = new StringBuilder();
		for (int i = 0; i != stages.size(); ++i) {
			r.append("stage ").append(i + 1).append(" (").append(direction).append("):");
			for (ProofProblem p : stages.get(i)) {
				r.append(" ").append(p.name());
			}
			r.append("\n");
		}
		return r.toString();
	}
}
