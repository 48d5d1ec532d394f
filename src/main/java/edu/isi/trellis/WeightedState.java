package edu.isi.trellis;

import java.util.Comparator;

// a state of the nondeterministic frontier with its accumulated score
public final class WeightedState {
	public static final Comparator<WeightedState> BY_STATE = new Comparator<WeightedState>() {
		public int compare(WeightedState a, WeightedState b) {
			return Integer.compare(a.state, b.state);
		}
	};

	private final double score;
	private final int state;

	public WeightedState(double score, int state) {
		this.score = score;
		this.state = state;
	}

	public double getScore() { return score; }
	public int getState() { return state; }

	public boolean equals(Object o) {
		if (!(o instanceof WeightedState))
			return false;
		WeightedState w = (WeightedState)o;
		return w.state == state && Double.compare(w.score, score) == 0;
	}

	public int hashCode() {
		return 31*state+Double.valueOf(score).hashCode();
	}

	public String toString() {
		return "("+score+", "+state+")";
	}
}
