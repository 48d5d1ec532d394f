package edu.isi.trellis;

import gnu.trove.iterator.TIntDoubleIterator;
import gnu.trove.map.hash.TIntDoubleHashMap;
import org.slf4j.Logger;

import java.io.IOException;

/**
 * Shared plumbing of the automaton predictors: configuration, the score
 * semiring picked from the sign convention, automaton loading, posterior
 * finalization and the distance table used by the heuristic.
 * <p>
 * Arc weights stay in the automaton as they were read (costs); they are
 * converted with {@link #score(Arc)} whenever a predictor looks at them.
 */
public abstract class AutomatonPredictor implements Predictor {
	protected final PredictorConfig config;
	protected final Semiring semiring;
	protected final AutomatonStore store;
	protected final Logger log;

	// automaton of the current sequence, null if there is none
	protected Automaton fst = null;
	protected int sequenceIndex = -1;

	// distance to final per state; null until initializeHeuristic
	private double[] distances = null;

	protected AutomatonPredictor(PredictorConfig config, Logger log) {
		this.config = config;
		this.log = log;
		this.semiring = config.getScoreSemiring();
		this.store = new AutomatonStore(config.getPath(), new AutomatonReader(config.getWeightKey()), log);
	}

	public PredictorConfig getConfig() {
		return config;
	}

	// current automaton, for inspection
	public Automaton getAutomaton() {
		return fst;
	}

	// arc weight in the score domain
	protected double score(Arc a) {
		return semiring.fromCost(a.getWeight());
	}

	// lattice of this sequence, label sorted, or null with a warning
	protected Automaton loadLattice(int sequenceIndex) {
		try {
			Automaton a = store.load(sequenceIndex);
			a.sortArcs();
			return a;
		}
		catch (IOException e) {
			log.warn("Could not load lattice for sentence {}: {}", sequenceIndex+1, e.getMessage());
		}
		catch (DataFormatException e) {
			log.warn("Could not load lattice for sentence {}: {}", sequenceIndex+1, e.getMessage());
		}
		return null;
	}

	protected void noPathWarning() {
		log.warn("The lattice for sentence {} does not contain any valid path. Please double-check "+
				"that the lattice is not empty and that paths contain the begin-of-sentence symbol {}.",
				sequenceIndex+1, config.getBosId());
	}

	// keeps the better of the old and new score of label
	protected void addBest(TIntDoubleHashMap scores, int label, double score) {
		if (!scores.containsKey(label) || semiring.better(score, scores.get(label)))
			scores.put(label, score);
	}

	// applies the use-weights and normalize settings
	protected TIntDoubleHashMap finalizePosterior(TIntDoubleHashMap scores) {
		if (scores.isEmpty())
			return scores;
		if (!config.useWeights()) {
			for (TIntDoubleIterator it = scores.iterator(); it.hasNext(); ) {
				it.advance();
				it.setValue(0.0);
			}
		}
		if (config.normalizeScores()) {
			double logSum = logSum(scores);
			if (logSum != Double.NEGATIVE_INFINITY && !Double.isNaN(logSum)) {
				for (TIntDoubleIterator it = scores.iterator(); it.hasNext(); ) {
					it.advance();
					it.setValue(it.value()-logSum);
				}
			}
		}
		return scores;
	}

	// log of the summed probabilities
	static double logSum(TIntDoubleHashMap scores) {
		double max = Double.NEGATIVE_INFINITY;
		for (TIntDoubleIterator it = scores.iterator(); it.hasNext(); ) {
			it.advance();
			max = Math.max(max, it.value());
		}
		if (max == Double.NEGATIVE_INFINITY || max == Double.POSITIVE_INFINITY)
			return max;
		double sum = 0;
		for (TIntDoubleIterator it = scores.iterator(); it.hasNext(); ) {
			it.advance();
			sum += Math.exp(it.value()-max);
		}
		return max+Math.log(sum);
	}

	// drop the distance table of the previous load
	protected void resetHeuristic() {
		distances = null;
	}

	public void initializeHeuristic(int sequenceIndex) {
		if (fst == null || distances != null)
			return;
		try {
			distances = ShortestDistance.distanceToFinal(fst);
		}
		catch (UnusualConditionException e) {
			log.warn("No heuristic for sentence {}: {}", sequenceIndex+1, e.getMessage());
		}
	}

	// remaining tropical distance from state, 0 without a table
	protected double distanceToFinal(int state) {
		if (distances == null || state < 0 || state >= distances.length)
			return 0.0;
		return distances[state];
	}

	public double getUnkProbability(TIntDoubleHashMap posterior) {
		return Double.NEGATIVE_INFINITY;
	}
}
