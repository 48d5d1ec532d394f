package edu.isi.trellis;
import java.io.Serializable;
// the general semiring. Subclasses do the operations
public abstract class Semiring implements Serializable {
	public abstract double plus(double a, double b);
	public abstract double times(double a, double b);
	// times(a, inverse(b)) undoes a times(x, b)
	public abstract double inverse(double a);
	// better means "closer to one"...sort of
	public abstract boolean better(double a, double b);
	public abstract boolean betteroreq(double a, double b);
	public abstract double ONE();
	public abstract double ZERO();

	// agenda priority for best-first search: larger pops first
	public abstract double agendaPriority(double a);

	// weights are stored as costs; a semiring knows how to read them
	public abstract double fromCost(double cost);

	// residual left over when b has been pulled out of a
	public double divide(double a, double b) {
		return times(a, inverse(b));
	}
}
