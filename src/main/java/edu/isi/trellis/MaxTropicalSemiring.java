package edu.isi.trellis;

// max, +, -INF, 0: the tropical semiring seen from log probabilities.
// costs are negated on the way in
public class MaxTropicalSemiring extends Semiring {
	public double plus(double a, double b) {
		return Math.max(a, b);
	}
	public double times(double a, double b) {
		return a+b;
	}
	public double inverse(double a) {
		return -a;
	}
	public boolean better(double a, double b) {
		return a>b;
	}
	public boolean betteroreq(double a, double b) {
		return a>=b;
	}
	// 0.0-cost so that a zero cost doesn't turn into -0.0
	public double fromCost(double cost) {
		return 0.0-cost;
	}
	public double agendaPriority(double a) {
		return a;
	}
	public double ZERO() {
		return Double.NEGATIVE_INFINITY;
	}
	public double ONE() {
		return 0;
	}
}
