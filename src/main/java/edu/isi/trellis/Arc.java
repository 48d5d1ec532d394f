package edu.isi.trellis;

import java.util.Comparator;

// a weighted transition. The weight is kept as it was read, i.e. as a cost.
// Arcs have no notion of value equality: two arcs with the same fields are
// still different arcs of the automaton
public class Arc {
	public static final int EPSILON = 0;

	// sort order used by label sorted automata
	public static final Comparator<Arc> BY_OLABEL = new Comparator<Arc>() {
		public int compare(Arc a, Arc b) {
			return Integer.compare(a.olabel, b.olabel);
		}
	};

	private final int from;
	private final int to;
	private final int ilabel;
	private final int olabel;
	private final double weight;

	public Arc(int from, int to, int ilabel, int olabel, double weight) {
		this.from = from;
		this.to = to;
		this.ilabel = ilabel;
		this.olabel = olabel;
		this.weight = weight;
	}

	public int getFrom() { return from; }
	public int getTo() { return to; }
	public int getILabel() { return ilabel; }
	public int getOLabel() { return olabel; }
	public double getWeight() { return weight; }

	public boolean isEpsilon() {
		return olabel == EPSILON;
	}

	// same arc, other end points. Used when copying automata around
	public Arc moved(int newFrom, int newTo) {
		return new Arc(newFrom, newTo, ilabel, olabel, weight);
	}

	public String toString() {
		return from+"\t"+to+"\t"+ilabel+"\t"+olabel+"\t"+weight;
	}
}
