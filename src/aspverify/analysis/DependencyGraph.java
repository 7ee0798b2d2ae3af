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
package aspverify.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.ImmutableValueGraph;
import com.google.common.graph.MutableValueGraph;
import com.google.common.graph.ValueGraphBuilder;

import aspverify.core.Program;
import aspverify.core.Program.Literal;
import aspverify.core.Program.Rule;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;

/**
 * The predicate dependency graph of a program. There is an edge
 * <code>p -&gt; q</code> whenever <code>q</code> occurs in the body of a rule
 * whose head is <code>p</code>. An edge is positive if some such occurrence is
 * neither negated nor doubly negated, and negative otherwise.
 *
 * @author David J. Pearce
 *
 */
public class DependencyGraph {
	public enum Polarity {
		POSITIVE, NEGATIVE
	}

	private final ImmutableValueGraph<Predicate, Polarity> graph;
	private final ImmutableSet<Predicate> choiceHeads;

	private DependencyGraph(MutableValueGraph<Predicate, Polarity> graph, Collection<Predicate> choiceHeads) {
		this.graph = ImmutableValueGraph.copyOf(graph);
		this.choiceHeads = ImmutableSet.copyOf(choiceHeads);
	}

	/**
	 * Construct the dependency graph of a given program.
	 *
	 * @param program
	 * @return
	 */
	public static DependencyGraph of(Program program) {
		MutableValueGraph<Predicate, Polarity> graph = ValueGraphBuilder.directed().allowsSelfLoops(true).build();
		ArrayList<Predicate> choiceHeads = new ArrayList<>();
		for (Rule r : program.rules()) {
			if (r.head() == null) {
				continue;
			}
			Predicate head = r.head().predicate();
			graph.addNode(head);
			if (r.kind() == Program.Kind.CHOICE) {
				choiceHeads.add(head);
			}
			for (Literal l : r.body()) {
				if (l.atom() instanceof Formula.Atom) {
					Predicate dependency = ((Formula.Atom) l.atom()).predicate();
					addEdge(graph, head, dependency, l.isPositive() ? Polarity.POSITIVE : Polarity.NEGATIVE);
				}
			}
		}
		return new DependencyGraph(graph, choiceHeads);
	}

	/**
	 * Construct the dependency graph of a theory of (universally closed)
	 * implications <code>B -&gt; p(t)</code>. An atom of <code>B</code> is
	 * positive unless it occurs beneath a negation or within the antecedent of
	 * a nested implication. Formulas of any other shape contribute no edges.
	 *
	 * @param theory
	 * @return
	 */
	public static DependencyGraph of(List<Formula> theory) {
		MutableValueGraph<Predicate, Polarity> graph = ValueGraphBuilder.directed().allowsSelfLoops(true).build();
		for (Formula f : theory) {
			while (f instanceof Formula.Universal) {
				f = ((Formula.Universal) f).body();
			}
			if (f instanceof Formula.Atom) {
				graph.addNode(((Formula.Atom) f).predicate());
			} else if (f instanceof Formula.Implication && ((Formula.Implication) f).rhs() instanceof Formula.Atom) {
				Formula.Implication i = (Formula.Implication) f;
				Predicate head = ((Formula.Atom) i.rhs()).predicate();
				graph.addNode(head);
				addEdges(graph, head, i.lhs(), true);
			}
		}
		return new DependencyGraph(graph, ImmutableSet.of());
	}

	private static void addEdges(MutableValueGraph<Predicate, Polarity> graph, Predicate head, Formula f,
			boolean positive) {
		if (f instanceof Formula.Atom) {
			addEdge(graph, head, ((Formula.Atom) f).predicate(), positive ? Polarity.POSITIVE : Polarity.NEGATIVE);
		} else if (f instanceof Formula.Negation) {
			addEdges(graph, head, ((Formula.Negation) f).operand(), false);
		} else if (f instanceof Formula.Nary) {
			for (Formula g : ((Formula.Nary) f).operands()) {
				addEdges(graph, head, g, positive);
			}
		} else if (f instanceof Formula.Implication) {
			addEdges(graph, head, ((Formula.Implication) f).lhs(), false);
			addEdges(graph, head, ((Formula.Implication) f).rhs(), positive);
		} else if (f instanceof Formula.Equivalence) {
			addEdges(graph, head, ((Formula.Equivalence) f).lhs(), false);
			addEdges(graph, head, ((Formula.Equivalence) f).rhs(), false);
		} else if (f instanceof Formula.Quantifier) {
			addEdges(graph, head, ((Formula.Quantifier) f).body(), positive);
		}
	}

	private static void addEdge(MutableValueGraph<Predicate, Polarity> graph, Predicate from, Predicate to,
			Polarity polarity) {
		Polarity existing = graph.edgeValueOrDefault(from, to, null);
		if (existing != Polarity.POSITIVE) {
			graph.putEdgeValue(from, to, polarity);
		}
	}

	public Set<Predicate> predicates() {
		return graph.nodes();
	}

	/**
	 * Get the polarity of the edge between two predicates, or null if there is
	 * no such edge.
	 *
	 * @param from
	 * @param to
	 * @return
	 */
	public Polarity polarity(Predicate from, Predicate to) {
		if (!graph.nodes().contains(from) || !graph.nodes().contains(to)) {
			return null;
		}
		return graph.edgeValueOrDefault(from, to, null);
	}

	/**
	 * A program is tight if there is no cycle made up of positive edges.
	 *
	 * @return
	 */
	public boolean isTight() {
		return positiveCycle().isEmpty();
	}

	/**
	 * Find a cycle made of positive edges, returning the predicates along it
	 * (in order) or an empty list if there is none.
	 *
	 * @return
	 */
	public List<Predicate> positiveCycle() {
		return findCycle(graph.nodes(), true);
	}

	/**
	 * Check whether the given private predicates are defined recursively, or by
	 * a choice rule.
	 *
	 * @param privates
	 * @return
	 */
	public boolean hasPrivateRecursion(Set<Predicate> privates) {
		return !privateRecursion(privates).isEmpty();
	}

	/**
	 * Find a witness for private recursion. This is either a single private
	 * predicate occurring in the head of a choice rule, or a cycle (along edges
	 * of either polarity) which visits only private predicates. An empty list
	 * means there is no private recursion.
	 *
	 * @param privates
	 * @return
	 */
	public List<Predicate> privateRecursion(Set<Predicate> privates) {
		for (Predicate p : choiceHeads) {
			if (privates.contains(p)) {
				return ImmutableList.of(p);
			}
		}
		ArrayList<Predicate> vertices = new ArrayList<>();
		for (Predicate p : graph.nodes()) {
			if (privates.contains(p)) {
				vertices.add(p);
			}
		}
		return findCycle(ImmutableSet.copyOf(vertices), false);
	}

	private static final int UNVISITED = 0;
	private static final int ACTIVE = 1;
	private static final int DONE = 2;

	/**
	 * Depth-first search for a cycle within the subgraph induced by the given
	 * vertices.
	 *
	 * @param vertices
	 * @param positiveOnly
	 *            Whether only positive edges are considered.
	 * @return
	 */
	private List<Predicate> findCycle(Set<Predicate> vertices, boolean positiveOnly) {
		HashMap<Predicate, Integer> state = new HashMap<>();
		ArrayList<Predicate> stack = new ArrayList<>();
		for (Predicate p : vertices) {
			List<Predicate> cycle = findCycle(p, vertices, positiveOnly, state, stack);
			if (cycle != null) {
				return cycle;
			}
		}
		return ImmutableList.of();
	}

	private List<Predicate> findCycle(Predicate p, Set<Predicate> vertices, boolean positiveOnly,
			Map<Predicate, Integer> state, List<Predicate> stack) {
		int s = state.getOrDefault(p, UNVISITED);
		if (s == ACTIVE) {
			return ImmutableList.copyOf(stack.subList(stack.indexOf(p), stack.size()));
		} else if (s == DONE) {
			return null;
		}
		state.put(p, ACTIVE);
		stack.add(p);
		for (Predicate q : graph.successors(p)) {
			if (!vertices.contains(q)) {
				continue;
			}
			if (positiveOnly && graph.edgeValueOrDefault(p, q, null) != Polarity.POSITIVE) {
				continue;
			}
			List<Predicate> cycle = findCycle(q, vertices, positiveOnly, state, stack);
			if (cycle != null) {
				return cycle;
			}
		}
		stack.remove(stack.size() - 1);
		state.put(p, DONE);
		return null;
	}

	@Override
	public String toString() {
		StringBuilder r = new StringBuilder();
		for (Predicate p : graph.nodes()) {
			for (Predicate q : graph.successors(p)) {
				r.append(p).append(" -> ").append(q).append(" [").append(graph.edgeValueOrDefault(p, q, null))
						.append("]\n");
			}
		}
		return r.toString();
	}
}
