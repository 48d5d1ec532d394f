package edu.isi.trellis;

import gnu.trove.map.hash.TIntDoubleHashMap;

/**
 * The incremental interface an external decoder drives. A decoder calls
 * {@link #initialize(int)} once per input sequence, then alternates
 * {@link #predictNext()} and {@link #consume(int)}, saving and restoring
 * snapshots with {@link #getState()} and {@link #setState(PredictorState)} to
 * explore several hypotheses.
 * <p>
 * None of the operations throws because of bad or missing data: a predictor
 * that cannot continue logs why and answers with empty distributions for the
 * rest of the sequence.
 */
public interface Predictor {

	/**
	 * Resets the predictor for a new input sequence and consumes the begin
	 * marker.
	 *
	 * @param sequenceIndex 0-based index of the input sequence
	 */
	void initialize(int sequenceIndex);

	/**
	 * @return scores of the symbols that may follow the consumed ones, in a new
	 *         map owned by the caller. Empty if the predictor is invalid.
	 */
	TIntDoubleHashMap predictNext();

	/**
	 * Advances by one symbol.
	 *
	 * @return the weight of what was traversed, 0 if nothing was
	 */
	double consume(int word);

	PredictorState getState();

	void setState(PredictorState state);

	/** Structural equality of two snapshots, for hypothesis recombination. */
	boolean isEqual(PredictorState state1, PredictorState state2);

	/** Score for a symbol outside of the predicted distribution. */
	double getUnkProbability(TIntDoubleHashMap posterior);

	void initializeHeuristic(int sequenceIndex);

	/**
	 * @param hypothesis the symbols of a partial hypothesis, the last one being
	 *                   the symbol about to be consumed
	 * @return lower bound on the remaining cost, 0 when nothing is known
	 */
	double estimateFutureCost(int[] hypothesis);
}
