package edu.isi.trellis;

import gnu.trove.map.hash.TIntDoubleHashMap;
import org.slf4j.Logger;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Late expansion of a recursive transition network. Starting from the root
 * automaton, nonterminal arcs are replaced by their sub automata only where a
 * path that spells the current history reaches them, and only until no such
 * arc is left. The expanded automaton is kept between calls, so work done for
 * a history is not redone for its extensions.
 * <p>
 * Nonterminal labels are ten digit numbers starting with one; everything
 * else is a word (or epsilon).
 */
public class RtnExpander {
	public static final int MIN_NONTERMINAL = 1000000000;
	public static final int MAX_NONTERMINAL = 1999999999;

	private Automaton fst;
	private final SubAutomatonCache cache;
	private final Semiring semiring;
	private final Logger log;
	private final int maxPasses;
	// whether the last scan found a path spelling the whole history
	private boolean spelled = false;

	// a scan agenda entry: node, position in the history, accumulated score
	private static class Item {
		final int node;
		final int pos;
		final double score;
		Item(int node, int pos, double score) {
			this.node = node;
			this.pos = pos;
			this.score = score;
		}
	}

	public RtnExpander(Automaton root, SubAutomatonCache cache, Semiring semiring, Logger log, int maxPasses) {
		this.fst = root;
		this.cache = cache;
		this.semiring = semiring;
		this.log = log;
		this.maxPasses = maxPasses;
	}

	public static boolean isNonterminal(int label) {
		return label >= MIN_NONTERMINAL && label <= MAX_NONTERMINAL;
	}

	public Automaton getAutomaton() {
		return fst;
	}

	public void setAutomaton(Automaton a) {
		fst = a;
	}

	// scan and splice until a scan finds no nonterminal. posterior gets the
	// words that may follow history, scored from the start state. Returns
	// false if no path spells history
	public boolean expand(int[] history, TIntDoubleHashMap posterior) {
		int passes = 0;
		while (true) {
			posterior.clear();
			int replaced = expandOnce(history, posterior);
			if (replaced == 0)
				return spelled;
			log.debug("Replaced {} nonterminal arcs for history {}", replaced, Arrays.toString(history));
			if (++passes >= maxPasses) {
				log.warn("Stopped expanding after {} passes for history {}; the grammar may be left recursive",
						passes, Arrays.toString(history));
				return spelled;
			}
		}
	}

	// one scan over the paths spelling history, then the nonterminal arcs
	// found on them are replaced. Returns the number of replaced arcs
	public int expandOnce(int[] history, TIntDoubleHashMap posterior) {
		spelled = false;
		if (fst == null || fst.isEmpty())
			return 0;
		LinkedHashSet<Arc> nonterminals = scan(history, posterior);
		for (Arc nt : nonterminals)
			Operations.replace(fst, nt, cache.get(nt.getOLabel()));
		return nonterminals.size();
	}

	// depth first from the start state. Epsilons are free, words must match
	// the next history symbol. Once the history is spelled, word arcs give
	// the posterior. The best score per (node, history position) is kept and
	// a node is only expanded again under the same position if it improved.
	// Improving epsilon cycles would keep that going forever, so the number of
	// pops is bounded as in bellman-ford, per history position
	private LinkedHashSet<Arc> scan(int[] history, TIntDoubleHashMap posterior) {
		fst.sortArcs();
		LinkedHashSet<Arc> nonterminals = new LinkedHashSet<Arc>();
		TIntDoubleHashMap[] visited = new TIntDoubleHashMap[history.length+1];
		for (int i = 0; i < visited.length; i++)
			visited[i] = new TIntDoubleHashMap();
		Deque<Item> agenda = new ArrayDeque<Item>();
		visit(agenda, visited, fst.getStartState(), 0, semiring.ONE());
		long maxPops = (long)fst.getNumStates() * (history.length+1) * (fst.getNumArcs()+1) + 1;
		long pops = 0;
		while (!agenda.isEmpty()) {
			if (++pops > maxPops) {
				log.warn("Scan for history {} does not converge; stopping after {} steps", Arrays.toString(history), maxPops);
				break;
			}
			Item it = agenda.pop();
			// a better path got here in the meantime
			if (semiring.better(visited[it.pos].get(it.node), it.score))
				continue;
			List<Arc> arcs = fst.getArcs(it.node);
			if (it.pos == history.length) {
				spelled = true;
				for (Arc a : arcs) {
					double s = semiring.times(it.score, semiring.fromCost(a.getWeight()));
					if (a.isEpsilon())
						visit(agenda, visited, a.getTo(), it.pos, s);
					else if (isNonterminal(a.getOLabel()))
						nonterminals.add(a);
					else if (!posterior.containsKey(a.getOLabel()) || semiring.better(s, posterior.get(a.getOLabel())))
						posterior.put(a.getOLabel(), s);
				}
				continue;
			}
			int next = history[it.pos];
			// epsilons sort first
			for (int i = fst.lowerBound(it.node, Arc.EPSILON); i < arcs.size() && arcs.get(i).isEpsilon(); i++) {
				Arc a = arcs.get(i);
				visit(agenda, visited, a.getTo(), it.pos, semiring.times(it.score, semiring.fromCost(a.getWeight())));
			}
			for (int i = fst.lowerBound(it.node, next); i < arcs.size() && arcs.get(i).getOLabel() == next; i++) {
				Arc a = arcs.get(i);
				visit(agenda, visited, a.getTo(), it.pos+1, semiring.times(it.score, semiring.fromCost(a.getWeight())));
			}
			// an unexpanded nonterminal may spell the rest of the history
			if (!isNonterminal(next)) {
				for (int i = fst.lowerBound(it.node, MIN_NONTERMINAL); i < arcs.size() && isNonterminal(arcs.get(i).getOLabel()); i++)
					nonterminals.add(arcs.get(i));
			}
		}
		return nonterminals;
	}

	private void visit(Deque<Item> agenda, TIntDoubleHashMap[] visited, int node, int pos, double score) {
		if (visited[pos].containsKey(node) && semiring.betteroreq(visited[pos].get(node), score))
			return;
		visited[pos].put(node, score);
		agenda.push(new Item(node, pos, score));
	}
}
