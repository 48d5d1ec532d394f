package edu.isi.trellis;

import edu.stanford.nlp.util.BinaryHeapPriorityQueue;

import java.util.Arrays;

// single source shortest distance, best-first with a relaxing agenda. Unlike
// plain dijkstra a state may be popped again when a later path improves it,
// so negative weights are fine as long as they don't form improving cycles
public class ShortestDistance {

	private ShortestDistance() {}

	public static double[] compute(Automaton a, int source, Semiring semiring) throws UnusualConditionException {
		int n = a.getNumStates();
		double[] dist = new double[n];
		Arrays.fill(dist, semiring.ZERO());
		if (source == Automaton.NO_STATE)
			return dist;
		dist[source] = semiring.ONE();
		BinaryHeapPriorityQueue<Integer> agenda = new BinaryHeapPriorityQueue<Integer>();
		agenda.add(source, semiring.agendaPriority(dist[source]));
		// bellman-ford bound on the number of improvements
		long maxPops = (long)n * (a.getNumArcs()+1) + 1;
		long pops = 0;
		while (!agenda.isEmpty()) {
			if (++pops > maxPops)
				throw new UnusualConditionException("Shortest distance does not converge; the automaton has an improving cycle");
			int s = agenda.removeFirst();
			for (Arc arc : a.getArcs(s)) {
				double d = semiring.times(dist[s], semiring.fromCost(arc.getWeight()));
				int t = arc.getTo();
				if (semiring.better(d, dist[t])) {
					dist[t] = d;
					double p = semiring.agendaPriority(d);
					if (agenda.contains(t))
						agenda.relaxPriority(t, p);
					else
						agenda.add(t, p);
				}
			}
		}
		return dist;
	}

	// tropical distance from every state to completion, final weight included.
	// computed on the reversed automaton from a fresh super initial state
	public static double[] distanceToFinal(Automaton a) throws UnusualConditionException {
		Automaton rev = Operations.reverse(a);
		double[] revDist = compute(rev, rev.getStartState(), new TropicalSemiring());
		return Arrays.copyOf(revDist, a.getNumStates());
	}
}
