package edu.isi.trellis;

import gnu.trove.set.hash.TIntHashSet;

import java.util.Arrays;
import java.util.Collection;

// the epsilon closed frontier of a nondeterministic lattice predictor. The
// canonical form is sorted by state id, whatever order it was built from
public final class FrontierState extends PredictorState {
	public static final FrontierState EMPTY = new FrontierState(new WeightedState[0]);

	private final WeightedState[] members;

	public FrontierState(WeightedState[] members) {
		this.members = members.clone();
		Arrays.sort(this.members, WeightedState.BY_STATE);
	}

	public FrontierState(Collection<WeightedState> members) {
		this(members.toArray(new WeightedState[members.size()]));
	}

	public WeightedState[] getMembers() {
		return members.clone();
	}

	public int size() {
		return members.length;
	}

	public boolean isEmpty() {
		return members.length == 0;
	}

	public TIntHashSet getStateIds() {
		TIntHashSet ids = new TIntHashSet();
		for (WeightedState w : members)
			ids.add(w.getState());
		return ids;
	}

	public boolean equals(Object o) {
		if (!(o instanceof FrontierState))
			return false;
		return Arrays.equals(members, ((FrontierState)o).members);
	}

	public int hashCode() {
		return Arrays.hashCode(members);
	}

	public String toString() {
		return "FrontierState"+Arrays.toString(members);
	}
}
