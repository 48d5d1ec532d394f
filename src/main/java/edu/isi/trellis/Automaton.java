package edu.isi.trellis;

import gnu.trove.iterator.TIntDoubleIterator;
import gnu.trove.map.hash.TIntDoubleHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A weighted automaton with dense integer states. Arcs are grouped by their
 * source state. Once {@link #sortArcs()} has been called (and nothing was
 * added since), the arcs of every state are ordered by output label, which
 * lets lookups stop early or binary search.
 */
public class Automaton {
	public static final int NO_STATE = -1;

	private int startState = NO_STATE;
	private final ArrayList<ArrayList<Arc>> arcs;
	private final TIntDoubleHashMap finals;
	private boolean labelSorted = false;
	private int numArcs = 0;

	public Automaton() {
		arcs = new ArrayList<ArrayList<Arc>>();
		finals = new TIntDoubleHashMap();
	}

	// a deep copy; arcs are immutable so they can be shared
	public Automaton(Automaton other) {
		arcs = new ArrayList<ArrayList<Arc>>(other.arcs.size());
		for (ArrayList<Arc> l : other.arcs)
			arcs.add(new ArrayList<Arc>(l));
		finals = new TIntDoubleHashMap(other.finals);
		startState = other.startState;
		labelSorted = other.labelSorted;
		numArcs = other.numArcs;
	}

	public int addState() {
		arcs.add(new ArrayList<Arc>());
		return arcs.size()-1;
	}

	// grow the state set so that id is a valid state
	public void ensureState(int id) {
		while (arcs.size() <= id)
			arcs.add(new ArrayList<Arc>());
	}

	public int getNumStates() {
		return arcs.size();
	}

	public int getNumArcs() {
		return numArcs;
	}

	public boolean isEmpty() {
		return startState == NO_STATE;
	}

	public int getStartState() {
		return startState;
	}

	public void setStartState(int s) {
		ensureState(s);
		startState = s;
	}

	public void addArc(Arc a) {
		ensureState(Math.max(a.getFrom(), a.getTo()));
		arcs.get(a.getFrom()).add(a);
		numArcs++;
		labelSorted = false;
	}

	public void addArc(int from, int to, int label, double weight) {
		addArc(new Arc(from, to, label, label, weight));
	}

	// removal by identity, so equal-looking parallel arcs survive
	public boolean removeArc(Arc a) {
		List<Arc> l = arcs.get(a.getFrom());
		for (int i = 0; i < l.size(); i++) {
			if (l.get(i) == a) {
				l.remove(i);
				numArcs--;
				return true;
			}
		}
		return false;
	}

	public List<Arc> getArcs(int state) {
		return Collections.unmodifiableList(arcs.get(state));
	}

	public int getNumArcs(int state) {
		return arcs.get(state).size();
	}

	public void setFinal(int state, double weight) {
		ensureState(state);
		finals.put(state, weight);
	}

	public boolean isFinal(int state) {
		return finals.containsKey(state);
	}

	// final weight of a non final state is the tropical zero
	public double getFinalWeight(int state) {
		if (!finals.containsKey(state))
			return Double.POSITIVE_INFINITY;
		return finals.get(state);
	}

	public int[] getFinalStates() {
		int[] ret = finals.keys();
		Arrays.sort(ret);
		return ret;
	}

	public TIntDoubleIterator finalIterator() {
		return finals.iterator();
	}

	public boolean isLabelSorted() {
		return labelSorted;
	}

	public void sortArcs() {
		if (labelSorted)
			return;
		for (ArrayList<Arc> l : arcs)
			Collections.sort(l, Arc.BY_OLABEL);
		labelSorted = true;
	}

	// first arc out of state with this output label. Stops at the first larger
	// label when sorted; unsorted states are scanned fully
	public Arc findArc(int state, int label) {
		List<Arc> l = arcs.get(state);
		if (labelSorted) {
			int i = lowerBound(state, label);
			if (i < l.size() && l.get(i).getOLabel() == label)
				return l.get(i);
			return null;
		}
		for (Arc a : l) {
			if (a.getOLabel() == label)
				return a;
		}
		return null;
	}

	// index of the first arc of state whose label is not smaller than label.
	// only meaningful on a label sorted automaton
	public int lowerBound(int state, int label) {
		if (!labelSorted)
			throw new IllegalStateException("lowerBound needs a label sorted automaton");
		List<Arc> l = arcs.get(state);
		int lo = 0;
		int hi = l.size();
		while (lo < hi) {
			int mid = (lo+hi) >>> 1;
			if (l.get(mid).getOLabel() < label)
				lo = mid+1;
			else
				hi = mid;
		}
		return lo;
	}

	public boolean hasEpsilons() {
		for (ArrayList<Arc> l : arcs) {
			for (Arc a : l) {
				if (a.isEpsilon())
					return true;
			}
		}
		return false;
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		if (startState != NO_STATE) {
			for (Arc a : arcs.get(startState))
				sb.append(a.toString()).append("\n");
		}
		for (int s = 0; s < arcs.size(); s++) {
			if (s == startState)
				continue;
			for (Arc a : arcs.get(s))
				sb.append(a.toString()).append("\n");
		}
		for (int f : getFinalStates())
			sb.append(f).append("\t").append(finals.get(f)).append("\n");
		return sb.toString();
	}
}
