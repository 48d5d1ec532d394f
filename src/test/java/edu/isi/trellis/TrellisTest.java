package edu.isi.trellis;

import gnu.trove.map.hash.TIntDoubleHashMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrellisTest {

	@TempDir
	File dir;

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	@BeforeEach
	void setUp() throws Exception {
		AutomatonFiles.write(dir, "1.fst",
				"0 1 1 1",
				"1 2 5 5 2.0",
				"1 2 6 6 0.5",
				"2 3 2 2",
				"3");
	}

	private int run(String... argv) {
		return Trellis.run(argv,
				new PrintStream(out, true),
				new PrintStream(err, true));
	}

	private String out() {
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	private String err() {
		return new String(err.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	void walks_lattice() {
		int status = run("--path", dir.getPath(), "5", "2");

		assertThat(status).isZero();
		assertThat(out()).contains(
				"predict 0: {5:-2.0, 6:-0.5}",
				"consume 5: -2.0",
				"predict 1: {2:0.0}",
				"consume 2: 0.0",
				"predict 2: {}");
	}

	@Test
	void costs_and_heuristic() {
		int status = run("-p", "nfst", "-f", dir.getPath(), "--cost", "--heuristic", "6");

		assertThat(status).isZero();
		assertThat(out()).contains(
				"predict 0: {5:2.0, 6:0.5}",
				"future cost of 6: 0.0",
				"consume 6: 0.5");
	}

	@Test
	void help_prints_usage() {
		int status = run("--help");

		assertThat(status).isZero();
		assertThat(out()).contains("Usage: trellis", "--predictor", "--add-bos-to-eos", "Predictor types: fst nfst rtn");
	}

	@Test
	void missing_path_is_an_error() {
		int status = run("5");

		assertThat(status).isEqualTo(1);
		assertThat(err()).contains("Usage: trellis");
	}

	@Test
	void rtn_options_need_rtn_predictor() {
		int status = run("-f", dir.getPath(), "--minimize");

		assertThat(status).isEqualTo(1);
		assertThat(err()).contains("only apply to the rtn predictor");
	}

	@Test
	void contradictory_rtn_options() {
		int status = run("-p", "rtn", "-f", dir.getPath(), "--minimize", "--no-rmeps");

		assertThat(status).isEqualTo(1);
		assertThat(err()).contains("cannot be combined");
	}

	@Test
	void epsilon_marker_is_rejected() {
		int status = run("-f", dir.getPath(), "--bos", "0");

		assertThat(status).isEqualTo(1);
		assertThat(err()).contains("epsilon");
	}

	@Test
	void index_is_one_based() {
		int status = run("-f", dir.getPath(), "--index", "0");

		assertThat(status).isEqualTo(1);
		assertThat(err()).contains("1-based");
	}

	@Test
	void predictor_types_by_name() throws Exception {
		assertThat(PredictorType.get("fst")).isEqualTo(PredictorType.FST);
		assertThat(PredictorType.get("RTN")).isEqualTo(PredictorType.RTN);
		assertThat(PredictorType.get("nfst").create(new PredictorConfig(dir.getPath())))
			.isInstanceOf(NondeterministicLatticePredictor.class);
		assertThatThrownBy(() -> PredictorType.get("lm"))
			.isInstanceOf(ConfigureException.class)
			.hasMessageContaining("fst nfst rtn");
	}

	@Test
	void format_sorts_labels() {
		TIntDoubleHashMap scores = new TIntDoubleHashMap();
		scores.put(9, -1.0);
		scores.put(3, -0.5);

		assertThat(Trellis.format(scores)).isEqualTo("{3:-0.5, 9:-1.0}");
	}
}
