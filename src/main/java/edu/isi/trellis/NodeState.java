package edu.isi.trellis;

// the single active node of a deterministic lattice predictor
public final class NodeState extends PredictorState {
	public static final NodeState INVALID = new NodeState(Automaton.NO_STATE);

	private final int node;

	public NodeState(int node) {
		this.node = node;
	}

	public int getNode() {
		return node;
	}

	public boolean isValid() {
		return node >= 0;
	}

	public boolean equals(Object o) {
		if (!(o instanceof NodeState))
			return false;
		return ((NodeState)o).node == node;
	}

	public int hashCode() {
		return node;
	}

	public String toString() {
		return "NodeState("+node+")";
	}
}
