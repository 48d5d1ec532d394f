package edu.isi.trellis;

import ch.qos.logback.classic.Level;
import gnu.trove.map.hash.TIntDoubleHashMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NondeterministicLatticePredictorTest {

	@TempDir
	File dir;

	private AutomatonFiles.CapturedLog captured;

	@BeforeEach
	void setUp() throws Exception {
		captured = AutomatonFiles.capture("nfst");
		// two paths spell 5: directly and behind an epsilon. 6 follows both,
		// 8 only the epsilon path
		AutomatonFiles.write(dir, "1.fst",
				"0 1 1 1 0.5",
				"1 2 5 5 1.0",
				"1 3 0 0 0.25",
				"3 4 5 5 0.5",
				"2 5 6 6 2.0",
				"4 6 0 0 0.0",
				"6 5 6 6 1.0",
				"6 5 8 8 4.0",
				"5 7 2 2 0.0",
				"7");
	}

	private NondeterministicLatticePredictor predictor(PredictorConfig config) {
		return new NondeterministicLatticePredictor(config, captured.log);
	}

	private PredictorConfig config() {
		return new PredictorConfig(dir.getPath());
	}

	@Test
	void best_path_per_word() {
		NondeterministicLatticePredictor p = predictor(config());
		p.initialize(0);

		TIntDoubleHashMap scores = p.predictNext();

		assertThat(scores.keys()).containsExactly(5);
		assertThat(scores.get(5)).isCloseTo(-0.75, within(1e-12));
	}

	@Test
	void consume_renormalizes_frontier() {
		NondeterministicLatticePredictor p = predictor(config());
		p.initialize(0);

		double w = p.consume(5);
		TIntDoubleHashMap scores = p.predictNext();

		assertThat(w).isCloseTo(-0.75, within(1e-12));
		// node 2 is 0.25 behind the best node 6
		assertThat(scores.get(6)).isCloseTo(-1.0, within(1e-12));
		assertThat(scores.get(8)).isCloseTo(-4.0, within(1e-12));
	}

	@Test
	void frontier_skips_epsilon_only_nodes() {
		NondeterministicLatticePredictor p = predictor(config());
		p.initialize(0);

		p.consume(5);

		FrontierState f = (FrontierState)p.getState();
		assertThat(f.getStateIds().toArray()).containsExactlyInAnyOrder(2, 6);
	}

	@Test
	void bos_weight_is_kept_when_not_skipped() {
		NondeterministicLatticePredictor p = predictor(config().setSkipBosWeight(false));
		p.initialize(0);

		TIntDoubleHashMap scores = p.predictNext();

		assertThat(scores.get(5)).isCloseTo(-1.25, within(1e-12));
	}

	@Test
	void closing_twice_changes_nothing() {
		NondeterministicLatticePredictor p = predictor(config());
		p.initialize(0);
		p.consume(5);
		FrontierState once = (FrontierState)p.getState();

		FrontierState twice = p.close(once);

		assertThat(twice).isEqualTo(once);
	}

	@Test
	void equality_ignores_order_and_scores() {
		NondeterministicLatticePredictor p = predictor(config());
		FrontierState a = new FrontierState(new WeightedState[] {
				new WeightedState(-1.0, 2), new WeightedState(0.0, 6)});
		FrontierState b = new FrontierState(new WeightedState[] {
				new WeightedState(-3.0, 6), new WeightedState(-0.5, 2)});
		FrontierState c = new FrontierState(new WeightedState[] {new WeightedState(0.0, 6)});

		assertThat(p.isEqual(a, b)).isTrue();
		assertThat(p.isEqual(a, c)).isFalse();
		assertThat(p.isEqual(a, new NodeState(2))).isFalse();
	}

	@Test
	void state_round_trip() {
		NondeterministicLatticePredictor p = predictor(config());
		p.initialize(0);
		p.consume(5);
		PredictorState saved = p.getState();
		TIntDoubleHashMap before = p.predictNext();

		p.consume(8);
		assertThat(p.predictNext().keys()).containsExactly(2);
		p.setState(saved);

		assertThat(p.predictNext()).isEqualTo(before);
	}

	@Test
	void unmatched_word_empties_frontier() {
		NondeterministicLatticePredictor p = predictor(config());
		p.initialize(0);

		double w = p.consume(42);

		assertThat(w).isEqualTo(0.0);
		assertThat(p.getState()).isEqualTo(FrontierState.EMPTY);
		assertThat(p.predictNext().isEmpty()).isTrue();
	}

	@Test
	void missing_lattice_warns() {
		NondeterministicLatticePredictor p = predictor(config());

		p.initialize(6);

		assertThat(captured.messages(Level.WARN)).anyMatch(m -> m.contains("sentence 7"));
		assertThat(p.predictNext().isEmpty()).isTrue();
	}

	@Test
	void epsilon_cycle_does_not_hang() throws Exception {
		AutomatonFiles.write(dir, "2.fst",
				"0 1 1 1",
				"1 2 0 0 -1.0",
				"2 1 0 0 -1.0",
				"2 3 5 5",
				"3");
		NondeterministicLatticePredictor p = predictor(config());

		p.initialize(1);

		assertThat(captured.messages(Level.WARN)).anyMatch(m -> m.contains("does not converge"));
		assertThat(p.predictNext().keys()).containsExactly(5);
	}

	@Test
	void heuristic_takes_best_member() {
		NondeterministicLatticePredictor p = predictor(config());
		p.initialize(0);
		p.initializeHeuristic(0);
		p.consume(5);

		// behind 6 lies node 5, one eos arc from final
		assertThat(p.estimateFutureCost(new int[] {5, 6})).isEqualTo(0.0);
		assertThat(p.estimateFutureCost(new int[] {5, 8})).isEqualTo(0.0);
		assertThat(p.estimateFutureCost(new int[] {5, 42})).isEqualTo(0.0);
	}

	@Test
	void heuristic_before_consume() {
		NondeterministicLatticePredictor p = predictor(config());
		p.initialize(0);
		p.initializeHeuristic(0);

		// 5 leads to node 2 (2.0 to go) and to node 4 (1.0 to go)
		assertThat(p.estimateFutureCost(new int[] {5})).isEqualTo(1.0);
	}

	@Test
	void normalized_scores_sum_to_one() {
		NondeterministicLatticePredictor p = predictor(config().setNormalizeScores(true));
		p.initialize(0);
		p.consume(5);

		TIntDoubleHashMap scores = p.predictNext();

		assertThat(scores.keys()).containsExactlyInAnyOrder(6, 8);
		double sum = 0;
		for (double v : scores.values())
			sum += Math.exp(v);
		assertThat(sum).isCloseTo(1.0, within(1e-9));
		assertThat(scores.get(6)).isGreaterThan(scores.get(8));
	}

	@Test
	void unweighted_scores_are_zero() {
		NondeterministicLatticePredictor p = predictor(config().setUseWeights(false));
		p.initialize(0);
		p.consume(5);

		TIntDoubleHashMap scores = p.predictNext();

		assertThat(scores.keys()).containsExactlyInAnyOrder(6, 8);
		for (double v : scores.values())
			assertThat(v).isEqualTo(0.0);
	}
}
