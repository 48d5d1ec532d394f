package edu.isi.trellis;

import java.util.Arrays;

// the consumed symbols of an rtn predictor since initialize
public final class HistoryState extends PredictorState {
	private final int[] history;

	public HistoryState(int[] history) {
		this.history = history.clone();
	}

	public int[] getHistory() {
		return history.clone();
	}

	public int length() {
		return history.length;
	}

	public boolean equals(Object o) {
		if (!(o instanceof HistoryState))
			return false;
		return Arrays.equals(history, ((HistoryState)o).history);
	}

	public int hashCode() {
		return Arrays.hashCode(history);
	}

	public String toString() {
		return "HistoryState"+Arrays.toString(history);
	}
}
