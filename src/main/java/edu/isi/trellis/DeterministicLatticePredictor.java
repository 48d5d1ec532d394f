package edu.isi.trellis;

import gnu.trove.map.hash.TIntDoubleHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Predictor for determinized lattices. The state is the current node, which
 * is unique because every node has at most one arc per label. A word without
 * an arc is read over the unknown-word arc if the node has one.
 */
public class DeterministicLatticePredictor extends AutomatonPredictor {

	private int curNode = Automaton.NO_STATE;
	// weight of the begin marker arc, folded into the end marker if not skipped
	private double bosScore = 0.0;

	public DeterministicLatticePredictor(PredictorConfig config) {
		this(config, LoggerFactory.getLogger(DeterministicLatticePredictor.class));
	}

	public DeterministicLatticePredictor(PredictorConfig config, Logger log) {
		super(config, log);
	}

	public void initialize(int sequenceIndex) {
		this.sequenceIndex = sequenceIndex;
		resetHeuristic();
		fst = loadLattice(sequenceIndex);
		curNode = (fst != null) ? fst.getStartState() : Automaton.NO_STATE;
		bosScore = consume(config.getBosId());
		if (curNode < 0 && fst != null)
			noPathWarning();
	}

	public TIntDoubleHashMap predictNext() {
		TIntDoubleHashMap scores = new TIntDoubleHashMap();
		if (curNode < 0)
			return scores;
		for (Arc a : fst.getArcs(curNode))
			addBest(scores, a.getOLabel(), score(a));
		int eos = config.getEosId();
		if (!config.skipBosWeight() && scores.containsKey(eos))
			scores.put(eos, semiring.times(scores.get(eos), bosScore));
		return finalizePosterior(scores);
	}

	// follows the arc labeled word, else the unknown word arc (which then
	// weighs nothing), else the predictor becomes invalid
	public double consume(int word) {
		if (curNode < 0)
			return 0.0;
		Arc a = fst.findArc(curNode, word);
		if (a != null) {
			curNode = a.getTo();
			return score(a);
		}
		Arc unk = fst.findArc(curNode, config.getUnkId());
		if (unk != null) {
			curNode = unk.getTo();
			return 0.0;
		}
		log.debug("No arc for {} at node {}; predictor is invalid for sentence {}", word, curNode, sequenceIndex+1);
		curNode = Automaton.NO_STATE;
		return 0.0;
	}

	public PredictorState getState() {
		return new NodeState(curNode);
	}

	public void setState(PredictorState state) {
		if (!(state instanceof NodeState))
			throw new IllegalArgumentException("Expected a NodeState but got "+state);
		curNode = ((NodeState)state).getNode();
	}

	public boolean isEqual(PredictorState state1, PredictorState state2) {
		return state1.equals(state2);
	}

	// the unknown word scores what its arc scores, if there is one
	public double getUnkProbability(TIntDoubleHashMap posterior) {
		if (posterior.containsKey(config.getUnkId()))
			return posterior.get(config.getUnkId());
		return Double.NEGATIVE_INFINITY;
	}

	// distance to final behind the arc of the last hypothesis word
	public double estimateFutureCost(int[] hypothesis) {
		if (curNode < 0 || hypothesis.length == 0)
			return 0.0;
		Arc a = fst.findArc(curNode, hypothesis[hypothesis.length-1]);
		if (a == null)
			return 0.0;
		return distanceToFinal(a.getTo());
	}

	public int getCurrentNode() {
		return curNode;
	}
}
