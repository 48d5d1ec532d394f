package edu.isi.trellis;

import gnu.trove.iterator.TIntDoubleIterator;
import gnu.trove.map.hash.TIntDoubleHashMap;
import gnu.trove.set.hash.TIntHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Predictor for lattices that are not determinized and may contain epsilon
 * arcs. The state is the set of nodes reachable from the start node through
 * the consumed words, each with the best score it is reached with. The set is
 * epsilon closed: every member has at least one arc with a word on it, nodes
 * with nothing but epsilons are passed through and never kept.
 * <p>
 * When several paths produce the same word the best of them is taken rather
 * than their sum.
 */
public class NondeterministicLatticePredictor extends AutomatonPredictor {

	private FrontierState frontier = FrontierState.EMPTY;

	public NondeterministicLatticePredictor(PredictorConfig config) {
		this(config, LoggerFactory.getLogger(NondeterministicLatticePredictor.class));
	}

	public NondeterministicLatticePredictor(PredictorConfig config, Logger log) {
		super(config, log);
	}

	public void initialize(int sequenceIndex) {
		this.sequenceIndex = sequenceIndex;
		resetHeuristic();
		fst = loadLattice(sequenceIndex);
		frontier = FrontierState.EMPTY;
		if (fst != null && !fst.isEmpty()) {
			TIntDoubleHashMap root = new TIntDoubleHashMap();
			root.put(fst.getStartState(), semiring.ONE());
			frontier = close(root);
		}
		consume(config.getBosId());
		if (frontier.isEmpty() && fst != null)
			noPathWarning();
	}

	// words on the non epsilon arcs of all frontier nodes, best score per word
	public TIntDoubleHashMap predictNext() {
		TIntDoubleHashMap scores = new TIntDoubleHashMap();
		for (WeightedState ws : frontier.getMembers()) {
			for (Arc a : fst.getArcs(ws.getState())) {
				if (a.isEpsilon())
					continue;
				addBest(scores, a.getOLabel(), semiring.times(ws.getScore(), score(a)));
			}
		}
		return finalizePosterior(scores);
	}

	// moves the frontier over all arcs labeled word. Scores are renormalized
	// so that the best new node scores one, except for a begin marker whose
	// weight is to be kept. Returns the best score word was reached with
	public double consume(int word) {
		if (frontier.isEmpty())
			return 0.0;
		TIntDoubleHashMap reached = new TIntDoubleHashMap();
		for (WeightedState ws : frontier.getMembers()) {
			int node = ws.getState();
			List<Arc> arcs = fst.getArcs(node);
			for (int i = fst.lowerBound(node, word); i < arcs.size() && arcs.get(i).getOLabel() == word; i++) {
				Arc a = arcs.get(i);
				double s = semiring.times(ws.getScore(), score(a));
				if (!reached.containsKey(a.getTo()) || semiring.better(s, reached.get(a.getTo())))
					reached.put(a.getTo(), s);
			}
		}
		if (reached.isEmpty()) {
			log.debug("No arc for {} from the frontier; predictor is invalid for sentence {}", word, sequenceIndex+1);
			frontier = FrontierState.EMPTY;
			return 0.0;
		}
		double best = semiring.ZERO();
		for (TIntDoubleIterator it = reached.iterator(); it.hasNext(); ) {
			it.advance();
			best = semiring.plus(best, it.value());
		}
		double consumed = (word != config.getBosId() || config.skipBosWeight()) ? best : semiring.ONE();
		for (TIntDoubleIterator it = reached.iterator(); it.hasNext(); ) {
			it.advance();
			it.setValue(semiring.divide(it.value(), consumed));
		}
		frontier = close(reached);
		return best;
	}

	// epsilon closure, breadth first. A node is opened again whenever a
	// better score reaches it; nodes with a word arc make up the result
	FrontierState close(TIntDoubleHashMap roots) {
		TIntDoubleHashMap visited = new TIntDoubleHashMap(roots);
		TIntDoubleHashMap open = new TIntDoubleHashMap(roots);
		TIntDoubleHashMap closed = new TIntDoubleHashMap();
		// without improving epsilon cycles every round is a bellman-ford round
		int maxRounds = fst.getNumStates()+1;
		int rounds = 0;
		while (!open.isEmpty()) {
			if (++rounds > maxRounds) {
				log.warn("Epsilon closure for sentence {} does not converge; stopping after {} rounds", sequenceIndex+1, maxRounds);
				break;
			}
			TIntDoubleHashMap nextOpen = new TIntDoubleHashMap();
			for (TIntDoubleIterator it = open.iterator(); it.hasNext(); ) {
				it.advance();
				int node = it.key();
				double s = it.value();
				boolean hasNonEps = false;
				for (Arc a : fst.getArcs(node)) {
					if (!a.isEpsilon()) {
						hasNonEps = true;
						continue;
					}
					double ns = semiring.times(s, score(a));
					int next = a.getTo();
					if (!visited.containsKey(next) || semiring.better(ns, visited.get(next))) {
						visited.put(next, ns);
						nextOpen.put(next, ns);
					}
				}
				if (hasNonEps)
					closed.put(node, s);
			}
			open = nextOpen;
		}
		List<WeightedState> members = new ArrayList<WeightedState>(closed.size());
		for (TIntDoubleIterator it = closed.iterator(); it.hasNext(); ) {
			it.advance();
			members.add(new WeightedState(it.value(), it.key()));
		}
		return new FrontierState(members);
	}

	// closes an existing frontier again; closing is idempotent
	FrontierState close(FrontierState f) {
		TIntDoubleHashMap roots = new TIntDoubleHashMap();
		for (WeightedState ws : f.getMembers())
			roots.put(ws.getState(), ws.getScore());
		return close(roots);
	}

	public PredictorState getState() {
		return frontier;
	}

	public void setState(PredictorState state) {
		if (!(state instanceof FrontierState))
			throw new IllegalArgumentException("Expected a FrontierState but got "+state);
		frontier = (FrontierState)state;
	}

	// same node ids, whatever the scores and order
	public boolean isEqual(PredictorState state1, PredictorState state2) {
		if (!(state1 instanceof FrontierState) || !(state2 instanceof FrontierState))
			return false;
		return Arrays.equals(sortedIds((FrontierState)state1), sortedIds((FrontierState)state2));
	}

	private static int[] sortedIds(FrontierState f) {
		TIntHashSet ids = f.getStateIds();
		int[] ret = ids.toArray();
		Arrays.sort(ret);
		return ret;
	}

	// smallest distance to final behind the first arc of each frontier node
	// that carries the last hypothesis word
	public double estimateFutureCost(int[] hypothesis) {
		if (hypothesis.length == 0)
			return 0.0;
		int last = hypothesis[hypothesis.length-1];
		boolean found = false;
		double best = Double.POSITIVE_INFINITY;
		for (WeightedState ws : frontier.getMembers()) {
			Arc a = fst.findArc(ws.getState(), last);
			if (a != null) {
				found = true;
				best = Math.min(best, distanceToFinal(a.getTo()));
			}
		}
		return found ? best : 0.0;
	}
}
