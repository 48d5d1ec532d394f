package edu.isi.trellis;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntDoubleHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Predictor over a recursive transition network: a root automaton whose arcs
 * may carry nonterminals standing for further automata. Nothing is expanded
 * up front. Before each prediction the nonterminals on paths spelling the
 * consumed history are replaced by their automata, see {@link RtnExpander}.
 * <p>
 * The state is the consumed history. Restoring a shorter history reuses the
 * automaton expanded so far, which is still valid for it.
 */
public class RtnPredictor extends AutomatonPredictor {

	private final int startNonterminal;
	private final String rootPrefix;
	private final SubAutomatonCache cache;

	private RtnExpander expander = null;
	private TIntArrayList history = new TIntArrayList();

	public RtnPredictor(PredictorConfig config) {
		this(config, LoggerFactory.getLogger(RtnPredictor.class));
	}

	public RtnPredictor(PredictorConfig config, Logger log) {
		super(config, log);
		startNonterminal = store.readStartNonterminal(config.getStartSymbol());
		rootPrefix = AutomatonStore.rootPrefix(startNonterminal);
		cache = new SubAutomatonCache(store, log);
	}

	public void initialize(int sequenceIndex) {
		this.sequenceIndex = sequenceIndex;
		resetHeuristic();
		history = new TIntArrayList();
		cache.reset(sequenceIndex);
		fst = null;
		expander = null;
		try {
			File root = store.resolveRtnRoot(sequenceIndex, rootPrefix);
			fst = store.read(root);
		}
		catch (IOException e) {
			log.error("Could not load the root automaton for sentence {}: {}", sequenceIndex+1, e.getMessage());
		}
		catch (DataFormatException e) {
			log.error("Could not load the root automaton for sentence {}: {}", sequenceIndex+1, e.getMessage());
		}
		if (fst != null && fst.isEmpty()) {
			log.error("Root automaton for sentence {} is empty", sequenceIndex+1);
			fst = null;
		}
		if (fst != null)
			expander = new RtnExpander(fst, cache, semiring, log, config.getMaxExpansionPasses());
		consume(config.getBosId());
		// paths have to start with the begin marker
		if (expander != null && !expander.expand(history.toArray(), new TIntDoubleHashMap()))
			noPathWarning();
	}

	public TIntDoubleHashMap predictNext() {
		TIntDoubleHashMap scores = new TIntDoubleHashMap();
		if (expander == null)
			return scores;
		expander.expand(history.toArray(), scores);
		fst = expander.getAutomaton();
		if (config.removeEpsilons() || config.minimize())
			fst = simplify(fst);
		expander.setAutomaton(fst);
		return finalizePosterior(scores);
	}

	// epsilon removal and, if asked for, determinization and minimization.
	// Whatever step fails leaves the automaton as it was before that step.
	// States only reachable through epsilons are dropped after the removal
	private Automaton simplify(Automaton a) {
		try {
			a = Operations.connect(Operations.removeEpsilons(a));
		}
		catch (UnusualConditionException e) {
			log.warn("Could not remove epsilons for sentence {}: {}", sequenceIndex+1, e.getMessage());
			return a;
		}
		if (!config.minimize())
			return a;
		try {
			a = Operations.determinize(a, config.getMaxDeterminizedStates());
		}
		catch (UnusualConditionException e) {
			log.warn("Could not determinize the expanded automaton for sentence {}: {}", sequenceIndex+1, e.getMessage());
			return a;
		}
		return Operations.minimize(a);
	}

	// only remembered; the weight shows up in the next prediction
	public double consume(int word) {
		history.add(word);
		return 0.0;
	}

	public PredictorState getState() {
		return new HistoryState(history.toArray());
	}

	public void setState(PredictorState state) {
		if (!(state instanceof HistoryState))
			throw new IllegalArgumentException("Expected a HistoryState but got "+state);
		history = new TIntArrayList(((HistoryState)state).getHistory());
	}

	public boolean isEqual(PredictorState state1, PredictorState state2) {
		return state1.equals(state2);
	}

	public void initializeHeuristic(int sequenceIndex) {
		log.debug("No heuristic for rtn predictor (sentence {})", sequenceIndex+1);
	}

	public double estimateFutureCost(int[] hypothesis) {
		return 0.0;
	}

	public int getStartNonterminal() {
		return startNonterminal;
	}

	RtnExpander getExpander() {
		return expander;
	}

	int[] getHistory() {
		return history.toArray();
	}
}
