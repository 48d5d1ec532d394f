package edu.isi.trellis;

import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.set.hash.TIntHashSet;
import org.slf4j.Logger;

import java.io.IOException;

// sub automata of one decoding session, keyed by nonterminal. A nonterminal
// whose automaton could not be read is remembered too, so it is reported once
public class SubAutomatonCache {
	private final AutomatonStore store;
	private final Logger log;
	private final TIntObjectHashMap<Automaton> loaded = new TIntObjectHashMap<Automaton>();
	private final TIntHashSet failed = new TIntHashSet();
	private int sequenceIndex = -1;

	public SubAutomatonCache(AutomatonStore store, Logger log) {
		this.store = store;
		this.log = log;
	}

	// forget everything; a new session starts
	public void reset(int sequenceIndex) {
		this.sequenceIndex = sequenceIndex;
		loaded.clear();
		failed.clear();
	}

	// null if the sub automaton cannot be read
	public Automaton get(int nonterminal) {
		Automaton a = loaded.get(nonterminal);
		if (a != null || failed.contains(nonterminal))
			return a;
		try {
			a = store.loadSubAutomaton(sequenceIndex, nonterminal);
			loaded.put(nonterminal, a);
			return a;
		}
		catch (IOException e) {
			return fail(nonterminal, e);
		}
		catch (DataFormatException e) {
			return fail(nonterminal, e);
		}
	}

	private Automaton fail(int nonterminal, Exception e) {
		log.error("Error reading sub automaton {} from {}: {}", nonterminal,
				store.getSubAutomatonFile(sequenceIndex, nonterminal).getPath(), e.getMessage());
		failed.add(nonterminal);
		return null;
	}

	public int size() {
		return loaded.size();
	}

	public boolean isCached(int nonterminal) {
		return loaded.containsKey(nonterminal);
	}
}
