package edu.isi.trellis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AutomatonReaderTest {

	@Test
	void first_arc_source_is_start_state() throws Exception {
		Automaton a = AutomatonFiles.parse(
				"3 4 1 1 0.5",
				"4 5 7 7",
				"5");

		assertThat(a.getStartState()).isEqualTo(3);
		assertThat(a.getNumArcs()).isEqualTo(2);
		assertThat(a.getArcs(3).get(0).getWeight()).isEqualTo(0.5);
		assertThat(a.getArcs(4).get(0).getWeight()).isEqualTo(0.0);
		assertThat(a.isFinal(5)).isTrue();
		assertThat(a.getFinalWeight(5)).isEqualTo(0.0);
		assertThat(a.isFinal(4)).isFalse();
	}

	@Test
	void final_weights_are_read() throws Exception {
		Automaton a = AutomatonFiles.parse("0 1 1 1", "1 2.5");

		assertThat(a.getFinalWeight(1)).isEqualTo(2.5);
		assertThat(a.getFinalWeight(0)).isEqualTo(Double.POSITIVE_INFINITY);
	}

	@Test
	void blank_lines_are_skipped() throws Exception {
		Automaton a = AutomatonFiles.parse("", "0\t1\t1\t1\t1.0", "   ", "1");

		assertThat(a.getNumArcs()).isEqualTo(1);
		assertThat(a.getStartState()).isEqualTo(0);
	}

	@Test
	void only_final_states_start_at_first_of_them() throws Exception {
		Automaton a = AutomatonFiles.parse("2", "0");

		assertThat(a.getStartState()).isEqualTo(2);
		assertThat(a.getNumArcs()).isZero();
	}

	@Test
	void empty_input_is_empty_automaton() throws Exception {
		Automaton a = AutomatonFiles.parse("");

		assertThat(a.isEmpty()).isTrue();
	}

	@Test
	void wrong_field_count_reports_line() {
		assertThatThrownBy(() -> AutomatonFiles.parse("0 1 1 1", "1 2 3"))
			.isInstanceOf(DataFormatException.class)
			.hasMessageContaining("test:2");
	}

	@Test
	void bad_numbers_are_rejected() {
		assertThatThrownBy(() -> AutomatonFiles.parse("0 1 x 1"))
			.isInstanceOf(DataFormatException.class)
			.hasMessageContaining("bad label x");
		assertThatThrownBy(() -> AutomatonFiles.parse("0 1 1 1 heavy"))
			.isInstanceOf(DataFormatException.class)
			.hasMessageContaining("bad weight");
		assertThatThrownBy(() -> AutomatonFiles.parse("-1 1 1 1"))
			.isInstanceOf(DataFormatException.class)
			.hasMessageContaining("negative state");
	}

	@Test
	void sparse_weight_uses_key_or_default() throws Exception {
		String text = "0 1 5 5 1.5,2,0.25,4,3.0\n1\n";

		Automaton byDefault = new AutomatonReader().read(new StringReader(text), "sparse");
		Automaton byTwo = new AutomatonReader(2).read(new StringReader(text), "sparse");
		Automaton byMissing = new AutomatonReader(9).read(new StringReader(text), "sparse");

		assertThat(byDefault.getArcs(0).get(0).getWeight()).isEqualTo(1.5);
		assertThat(byTwo.getArcs(0).get(0).getWeight()).isEqualTo(0.25);
		assertThat(byMissing.getArcs(0).get(0).getWeight()).isEqualTo(1.5);
	}

	@Test
	void sparse_weight_needs_pairs() throws Exception {
		assertThatThrownBy(() -> SparseWeight.parse("1.0,2"))
			.isInstanceOf(DataFormatException.class);
		assertThatThrownBy(() -> SparseWeight.parse("1.0,0,2.0"))
			.isInstanceOf(DataFormatException.class)
			.hasMessageContaining("reserved");

		SparseWeight w = SparseWeight.parse("-0.5,3,1.25");
		assertThat(w.size()).isEqualTo(2);
		assertThat(w.get(3)).isCloseTo(1.25, within(1e-12));
		assertThat(w.get(SparseWeight.DEFAULT_KEY)).isCloseTo(-0.5, within(1e-12));
	}

	@Test
	void reads_utf8_file(@TempDir File dir) throws Exception {
		File f = AutomatonFiles.write(dir, "1.fst", "0 1 1 1", "1 2 9 9 0.75", "2");

		Automaton a = new AutomatonReader().read(f);

		assertThat(a.getNumStates()).isEqualTo(3);
		assertThat(a.findArc(1, 9).getTo()).isEqualTo(2);
	}
}
