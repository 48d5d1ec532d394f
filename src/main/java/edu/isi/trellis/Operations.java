package edu.isi.trellis;

import edu.stanford.nlp.util.BinaryHeapPriorityQueue;
import gnu.trove.iterator.TIntDoubleIterator;
import gnu.trove.iterator.TIntObjectIterator;
import gnu.trove.map.hash.TIntDoubleHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;

/**
 * Whole-automaton transformations. All of them work in the tropical semiring
 * on the weights as stored (costs) and treat automata as acceptors on the
 * output label.
 */
public class Operations {

	// residuals are compared after rounding to this many decimals
	private static final double RESIDUAL_SCALE = 1e6;

	private Operations() {}

	// arcs turned around; a fresh start state reaches the old final states
	// through epsilons that carry the final weights
	public static Automaton reverse(Automaton a) {
		Automaton rev = new Automaton();
		int n = a.getNumStates();
		rev.ensureState(n);
		for (int s = 0; s < n; s++) {
			for (Arc arc : a.getArcs(s))
				rev.addArc(new Arc(arc.getTo(), arc.getFrom(), arc.getILabel(), arc.getOLabel(), arc.getWeight()));
		}
		rev.setStartState(n);
		for (TIntDoubleIterator it = a.finalIterator(); it.hasNext(); ) {
			it.advance();
			rev.addArc(new Arc(n, it.key(), Arc.EPSILON, Arc.EPSILON, it.value()));
		}
		if (!a.isEmpty())
			rev.setFinal(a.getStartState(), 0);
		return rev;
	}

	// splice sub into target in place of ntArc: sub is copied with fresh state
	// ids, entered by an epsilon carrying the arc weight and left from each of
	// its final states by an epsilon carrying the final weight.
	// returns the number of states added
	public static int replace(Automaton target, Arc ntArc, Automaton sub) {
		target.removeArc(ntArc);
		if (sub == null || sub.isEmpty())
			return 0;
		int offset = target.getNumStates();
		target.ensureState(offset+sub.getNumStates()-1);
		for (int s = 0; s < sub.getNumStates(); s++) {
			for (Arc arc : sub.getArcs(s))
				target.addArc(arc.moved(arc.getFrom()+offset, arc.getTo()+offset));
		}
		target.addArc(new Arc(ntArc.getFrom(), sub.getStartState()+offset, Arc.EPSILON, Arc.EPSILON, ntArc.getWeight()));
		for (TIntDoubleIterator it = sub.finalIterator(); it.hasNext(); ) {
			it.advance();
			target.addArc(new Arc(it.key()+offset, ntArc.getTo(), Arc.EPSILON, Arc.EPSILON, it.value()));
		}
		return sub.getNumStates();
	}

	// epsilon removal: every state gets the non-epsilon arcs and final weights
	// of everything in its epsilon closure, weighted by the closure distance.
	// state ids are kept; states only reachable through epsilons become
	// unreachable
	public static Automaton removeEpsilons(Automaton a) throws UnusualConditionException {
		Automaton ret = new Automaton();
		int n = a.getNumStates();
		if (n == 0)
			return ret;
		ret.ensureState(n-1);
		ret.setStartState(a.getStartState());
		for (int s = 0; s < n; s++) {
			TIntDoubleHashMap closure = epsilonClosure(a, s);
			// olabel -> dest -> best weight
			TIntObjectHashMap<TIntDoubleHashMap> best = new TIntObjectHashMap<TIntDoubleHashMap>();
			double finalWeight = Double.POSITIVE_INFINITY;
			for (TIntDoubleIterator it = closure.iterator(); it.hasNext(); ) {
				it.advance();
				int t = it.key();
				double d = it.value();
				if (a.isFinal(t))
					finalWeight = Math.min(finalWeight, d+a.getFinalWeight(t));
				for (Arc arc : a.getArcs(t)) {
					if (arc.isEpsilon())
						continue;
					TIntDoubleHashMap dests = best.get(arc.getOLabel());
					if (dests == null) {
						dests = new TIntDoubleHashMap();
						best.put(arc.getOLabel(), dests);
					}
					double w = d+arc.getWeight();
					if (!dests.containsKey(arc.getTo()) || w < dests.get(arc.getTo()))
						dests.put(arc.getTo(), w);
				}
			}
			for (TIntObjectIterator<TIntDoubleHashMap> lit = best.iterator(); lit.hasNext(); ) {
				lit.advance();
				int label = lit.key();
				for (TIntDoubleIterator dit = lit.value().iterator(); dit.hasNext(); ) {
					dit.advance();
					ret.addArc(new Arc(s, dit.key(), label, label, dit.value()));
				}
			}
			if (finalWeight != Double.POSITIVE_INFINITY)
				ret.setFinal(s, finalWeight);
		}
		return ret;
	}

	// keeps only the states reachable from the start state, renumbered in
	// breadth first order so the start state becomes 0
	public static Automaton connect(Automaton a) {
		Automaton ret = new Automaton();
		if (a.isEmpty())
			return ret;
		int[] ids = new int[a.getNumStates()];
		Arrays.fill(ids, Automaton.NO_STATE);
		LinkedList<Integer> queue = new LinkedList<Integer>();
		ids[a.getStartState()] = ret.addState();
		ret.setStartState(ids[a.getStartState()]);
		queue.add(a.getStartState());
		while (!queue.isEmpty()) {
			int s = queue.removeFirst();
			for (Arc arc : a.getArcs(s)) {
				int t = arc.getTo();
				if (ids[t] == Automaton.NO_STATE) {
					ids[t] = ret.addState();
					queue.add(t);
				}
				ret.addArc(arc.moved(ids[s], ids[t]));
			}
			if (a.isFinal(s))
				ret.setFinal(ids[s], a.getFinalWeight(s));
		}
		return ret;
	}

	// tropical distances from s over epsilon arcs only, s itself included at 0
	static TIntDoubleHashMap epsilonClosure(Automaton a, int s) throws UnusualConditionException {
		TIntDoubleHashMap dist = new TIntDoubleHashMap();
		dist.put(s, 0);
		BinaryHeapPriorityQueue<Integer> agenda = new BinaryHeapPriorityQueue<Integer>();
		agenda.add(s, 0.0);
		long maxPops = (long)a.getNumStates() * (a.getNumArcs()+1) + 1;
		long pops = 0;
		while (!agenda.isEmpty()) {
			if (++pops > maxPops)
				throw new UnusualConditionException("Epsilon closure of state "+s+" does not converge");
			int t = agenda.removeFirst();
			double dt = dist.get(t);
			for (Arc arc : a.getArcs(t)) {
				if (!arc.isEpsilon())
					continue;
				double d = dt+arc.getWeight();
				int u = arc.getTo();
				if (!dist.containsKey(u) || d < dist.get(u)) {
					dist.put(u, d);
					if (agenda.contains(u))
						agenda.relaxPriority(u, -d);
					else
						agenda.add(u, -d);
				}
			}
		}
		return dist;
	}

	// a determinization state: source states with their residual weights
	static class Subset {
		final int[] states;
		final long[] residuals;
		final double[] exact;
		private final int hsh;

		Subset(TIntDoubleHashMap members) {
			states = members.keys();
			Arrays.sort(states);
			residuals = new long[states.length];
			exact = new double[states.length];
			for (int i = 0; i < states.length; i++) {
				exact[i] = members.get(states[i]);
				residuals[i] = Math.round(exact[i]*RESIDUAL_SCALE);
			}
			hsh = 31*Arrays.hashCode(states)+Arrays.hashCode(residuals);
		}
		public int hashCode() {
			return hsh;
		}
		public boolean equals(Object o) {
			if (!(o instanceof Subset))
				return false;
			Subset other = (Subset)o;
			return Arrays.equals(states, other.states) && Arrays.equals(residuals, other.residuals);
		}
	}

	// weighted subset construction (tropical). Epsilons are removed first.
	// Cyclic automata need not be determinizable, so the number of subsets is
	// bounded by maxStates
	public static Automaton determinize(Automaton a, int maxStates) throws UnusualConditionException {
		if (a.hasEpsilons())
			a = removeEpsilons(a);
		Automaton ret = new Automaton();
		if (a.isEmpty())
			return ret;
		HashMap<Subset, Integer> ids = new HashMap<Subset, Integer>();
		LinkedList<Subset> queue = new LinkedList<Subset>();
		TIntDoubleHashMap init = new TIntDoubleHashMap();
		init.put(a.getStartState(), 0);
		Subset start = new Subset(init);
		ids.put(start, ret.addState());
		ret.setStartState(0);
		queue.add(start);
		while (!queue.isEmpty()) {
			Subset cur = queue.removeFirst();
			int curId = ids.get(cur);
			double finalWeight = Double.POSITIVE_INFINITY;
			TIntObjectHashMap<TIntDoubleHashMap> byLabel = new TIntObjectHashMap<TIntDoubleHashMap>();
			for (int i = 0; i < cur.states.length; i++) {
				int q = cur.states[i];
				double r = cur.exact[i];
				if (a.isFinal(q))
					finalWeight = Math.min(finalWeight, r+a.getFinalWeight(q));
				for (Arc arc : a.getArcs(q)) {
					TIntDoubleHashMap dests = byLabel.get(arc.getOLabel());
					if (dests == null) {
						dests = new TIntDoubleHashMap();
						byLabel.put(arc.getOLabel(), dests);
					}
					double w = r+arc.getWeight();
					if (!dests.containsKey(arc.getTo()) || w < dests.get(arc.getTo()))
						dests.put(arc.getTo(), w);
				}
			}
			if (finalWeight != Double.POSITIVE_INFINITY)
				ret.setFinal(curId, finalWeight);
			int[] labels = byLabel.keys();
			Arrays.sort(labels);
			for (int label : labels) {
				TIntDoubleHashMap dests = byLabel.get(label);
				double w = Double.POSITIVE_INFINITY;
				for (TIntDoubleIterator it = dests.iterator(); it.hasNext(); ) {
					it.advance();
					w = Math.min(w, it.value());
				}
				TIntDoubleHashMap next = new TIntDoubleHashMap();
				for (TIntDoubleIterator it = dests.iterator(); it.hasNext(); ) {
					it.advance();
					next.put(it.key(), it.value()-w);
				}
				Subset ns = new Subset(next);
				Integer nextId = ids.get(ns);
				if (nextId == null) {
					if (ids.size() >= maxStates)
						throw new UnusualConditionException("Determinization exceeded "+maxStates+" states; the automaton may not be determinizable");
					nextId = ret.addState();
					ids.put(ns, nextId);
					queue.add(ns);
				}
				ret.addArc(new Arc(curId, nextId, label, label, w));
			}
		}
		return ret;
	}

	// merges states with identical futures (moore style partition refinement).
	// expects a deterministic automaton; weights are not pushed, so this is
	// minimal only up to weight distribution along paths
	public static Automaton minimize(Automaton a) {
		Automaton ret = new Automaton();
		int n = a.getNumStates();
		if (a.isEmpty())
			return ret;
		int[] cls = new int[n];
		int numClasses = refine(a, cls, null);
		while (true) {
			int[] next = new int[n];
			int nextCount = refine(a, next, cls);
			cls = next;
			if (nextCount == numClasses)
				break;
			numClasses = nextCount;
		}
		ret.ensureState(numClasses-1);
		ret.setStartState(cls[a.getStartState()]);
		boolean[] done = new boolean[numClasses];
		for (int s = 0; s < n; s++) {
			int c = cls[s];
			if (done[c])
				continue;
			done[c] = true;
			for (Arc arc : a.getArcs(s))
				ret.addArc(new Arc(c, cls[arc.getTo()], arc.getILabel(), arc.getOLabel(), arc.getWeight()));
			if (a.isFinal(s))
				ret.setFinal(c, a.getFinalWeight(s));
		}
		return ret;
	}

	// one refinement round. With no previous classes, states are split on
	// their final weight alone
	private static int refine(Automaton a, int[] cls, int[] prev) {
		HashMap<String, Integer> sigs = new HashMap<String, Integer>();
		for (int s = 0; s < a.getNumStates(); s++) {
			StringBuffer sig = new StringBuffer();
			if (a.isFinal(s))
				sig.append("F").append(Math.round(a.getFinalWeight(s)*RESIDUAL_SCALE));
			else
				sig.append("N");
			if (prev != null) {
				sig.append("|").append(prev[s]);
				List<Arc> arcs = new ArrayList<Arc>(a.getArcs(s));
				Collections.sort(arcs, Arc.BY_OLABEL);
				for (Arc arc : arcs) {
					sig.append("|").append(arc.getOLabel()).append(":")
						.append(Math.round(arc.getWeight()*RESIDUAL_SCALE)).append(">")
						.append(prev[arc.getTo()]);
				}
			}
			String key = sig.toString();
			Integer c = sigs.get(key);
			if (c == null) {
				c = sigs.size();
				sigs.put(key, c);
			}
			cls[s] = c;
		}
		return sigs.size();
	}
}
