package edu.isi.trellis;

// tropical is min, +, +INF, 0. Arc weights on disk live here.
public class TropicalSemiring extends Semiring {
	public double plus(double a, double b) {
		return Math.min(a, b);
	}
	public double times(double a, double b) {
		return a+b;
	}
	public double inverse(double a) {
		return -a;
	}
	public boolean better(double a, double b) {
		return a<b;
	}
	public boolean betteroreq(double a, double b) {
		return a<=b;
	}
	public double fromCost(double cost) {
		return cost;
	}
	public double agendaPriority(double a) {
		return -a;
	}
	public double ZERO() {
		return Double.POSITIVE_INFINITY;
	}
	public double ONE() {
		return 0;
	}
}
