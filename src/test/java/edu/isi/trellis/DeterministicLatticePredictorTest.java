package edu.isi.trellis;

import ch.qos.logback.classic.Level;
import gnu.trove.map.hash.TIntDoubleHashMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DeterministicLatticePredictorTest {

	@TempDir
	File dir;

	private AutomatonFiles.CapturedLog captured;

	@BeforeEach
	void setUp() throws Exception {
		captured = AutomatonFiles.capture("fst");
		// bos, then 5 or 6, then 7 or eos
		AutomatonFiles.write(dir, "1.fst",
				"0 1 1 1 0.5",
				"1 2 5 5 2.0",
				"1 3 6 6 1.0",
				"2 4 7 7 0.25",
				"3 4 2 2 3.0",
				"2 4 3 3 4.0",
				"4");
	}

	private DeterministicLatticePredictor predictor(PredictorConfig config) {
		return new DeterministicLatticePredictor(config, captured.log);
	}

	private PredictorConfig config() {
		return new PredictorConfig(dir.getPath());
	}

	@Test
	void start_scores_are_negated_arc_weights() throws Exception {
		AutomatonFiles.write(dir, "3.fst", "0 1 1 1 0", "1 2 5 5 2.0", "2");
		DeterministicLatticePredictor p = predictor(config());

		p.initialize(2);
		TIntDoubleHashMap scores = p.predictNext();

		assertThat(scores.size()).isEqualTo(1);
		assertThat(scores.get(5)).isEqualTo(-2.0);
	}

	@Test
	void consume_follows_arcs() {
		DeterministicLatticePredictor p = predictor(config());
		p.initialize(0);

		double w = p.consume(5);
		TIntDoubleHashMap scores = p.predictNext();

		assertThat(w).isEqualTo(-2.0);
		assertThat(scores.keys()).containsExactlyInAnyOrder(7, 3);
		assertThat(scores.get(7)).isEqualTo(-0.25);
	}

	@Test
	void costs_when_log_conversion_is_off() {
		DeterministicLatticePredictor p = predictor(config().setToLog(false));
		p.initialize(0);

		TIntDoubleHashMap scores = p.predictNext();

		assertThat(scores.get(5)).isEqualTo(2.0);
		assertThat(scores.get(6)).isEqualTo(1.0);
	}

	@Test
	void missing_lattice_warns_and_predicts_nothing() {
		DeterministicLatticePredictor p = predictor(config());

		p.initialize(6);

		assertThat(captured.messages(Level.WARN)).anyMatch(m -> m.contains("sentence 7"));
		assertThat(p.predictNext().isEmpty()).isTrue();
		assertThat(p.consume(5)).isEqualTo(0.0);
		assertThat(p.predictNext().isEmpty()).isTrue();
		assertThat(p.getState()).isEqualTo(NodeState.INVALID);
		assertThat(((NodeState)p.getState()).isValid()).isFalse();
	}

	@Test
	void lattice_without_bos_has_no_path() throws Exception {
		AutomatonFiles.write(dir, "2.fst", "0 1 5 5", "1");
		DeterministicLatticePredictor p = predictor(config());

		p.initialize(1);

		assertThat(captured.messages(Level.WARN)).anyMatch(m -> m.contains("does not contain any valid path"));
		assertThat(p.predictNext().isEmpty()).isTrue();
	}

	@Test
	void unknown_word_arc_is_taken_for_missing_words() {
		DeterministicLatticePredictor p = predictor(config());
		p.initialize(0);
		p.consume(5);

		double w = p.consume(99);

		assertThat(w).isEqualTo(0.0);
		assertThat(p.getCurrentNode()).isEqualTo(4);
	}

	@Test
	void unknown_probability_is_unk_score() {
		DeterministicLatticePredictor p = predictor(config());
		p.initialize(0);
		p.consume(5);

		TIntDoubleHashMap scores = p.predictNext();

		assertThat(p.getUnkProbability(scores)).isEqualTo(-4.0);
		p.consume(7);
		assertThat(p.getUnkProbability(p.predictNext())).isEqualTo(Double.NEGATIVE_INFINITY);
	}

	@Test
	void word_without_arc_invalidates() {
		DeterministicLatticePredictor p = predictor(config());
		p.initialize(0);

		p.consume(42);

		assertThat(p.getCurrentNode()).isEqualTo(Automaton.NO_STATE);
		assertThat(p.predictNext().isEmpty()).isTrue();
	}

	@Test
	void state_round_trip() {
		DeterministicLatticePredictor p = predictor(config());
		p.initialize(0);
		PredictorState saved = p.getState();
		TIntDoubleHashMap before = p.predictNext();

		p.consume(6);
		assertThat(p.isEqual(saved, p.getState())).isFalse();
		p.setState(saved);

		assertThat(p.predictNext()).isEqualTo(before);
		assertThat(p.isEqual(saved, p.getState())).isTrue();
	}

	@Test
	void foreign_state_is_rejected() {
		DeterministicLatticePredictor p = predictor(config());
		p.initialize(0);

		assertThatThrownBy(() -> p.setState(new HistoryState(new int[] {1})))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void normalized_scores_sum_to_one() {
		DeterministicLatticePredictor p = predictor(config().setNormalizeScores(true));
		p.initialize(0);

		TIntDoubleHashMap scores = p.predictNext();

		double sum = 0;
		for (double v : scores.values())
			sum += Math.exp(v);
		assertThat(sum).isCloseTo(1.0, within(1e-9));
	}

	@Test
	void unweighted_scores_are_zero() {
		DeterministicLatticePredictor p = predictor(config().setUseWeights(false));
		p.initialize(0);
		p.consume(5);

		TIntDoubleHashMap scores = p.predictNext();

		assertThat(scores.size()).isEqualTo(2);
		for (double v : scores.values())
			assertThat(v).isEqualTo(0.0);
	}

	@Test
	void bos_weight_goes_to_eos_when_kept() {
		DeterministicLatticePredictor p = predictor(config().setSkipBosWeight(false));
		p.initialize(0);
		p.consume(6);

		TIntDoubleHashMap scores = p.predictNext();

		assertThat(scores.get(2)).isCloseTo(-3.5, within(1e-12));
	}

	@Test
	void heuristic_is_distance_behind_arc() {
		DeterministicLatticePredictor p = predictor(config());
		p.initialize(0);

		assertThat(p.estimateFutureCost(new int[] {5})).isEqualTo(0.0);
		p.initializeHeuristic(0);

		assertThat(p.estimateFutureCost(new int[] {5})).isEqualTo(0.25);
		assertThat(p.estimateFutureCost(new int[] {6})).isEqualTo(3.0);
		assertThat(p.estimateFutureCost(new int[] {42})).isEqualTo(0.0);
		assertThat(p.estimateFutureCost(new int[0])).isEqualTo(0.0);
	}

	@Test
	void path_template_selects_file() throws Exception {
		AutomatonFiles.write(dir, "lat/4.txt", "0 1 1 1", "1 2 9 9 1.5", "2");
		DeterministicLatticePredictor p = predictor(new PredictorConfig(new File(dir, "lat/%d.txt").getPath()));

		p.initialize(3);

		assertThat(p.predictNext().get(9)).isEqualTo(-1.5);
	}
}
