package edu.isi.trellis;

/**
 * Opaque snapshot of a predictor's traversal position, as handed out by
 * {@link Predictor#getState()}. Snapshots are immutable values: they copy what
 * they are built from and what they hand out, so the external search may keep
 * as many of them as it likes without them affecting each other.
 */
public abstract class PredictorState {
	PredictorState() {}
}
