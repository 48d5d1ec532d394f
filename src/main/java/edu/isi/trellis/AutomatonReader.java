package edu.isi.trellis;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

// reads automata in the line based text format:
//   src dst ilabel olabel [weight]     an arc
//   state [weight]                     a final state
// the source of the first arc is the start state. A weight with commas in it
// is a sparse weight map, resolved to a single number with the weight key.
public class AutomatonReader {

	private static Pattern fieldSplitPat = Pattern.compile("\\s+");

	// empty spaces
	private static Pattern blankPat = Pattern.compile("\\s*");

	private final int weightKey;

	public AutomatonReader() {
		this(SparseWeight.DEFAULT_KEY);
	}

	public AutomatonReader(int weightKey) {
		this.weightKey = weightKey;
	}

	public int getWeightKey() {
		return weightKey;
	}

	public Automaton read(File f) throws IOException, DataFormatException {
		BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(f), StandardCharsets.UTF_8));
		try {
			return read(br, f.getPath());
		}
		finally {
			br.close();
		}
	}

	public Automaton read(Reader r, String name) throws IOException, DataFormatException {
		BufferedReader br = (r instanceof BufferedReader) ? (BufferedReader)r : new BufferedReader(r);
		Automaton a = new Automaton();
		// a file made only of final states starts at the first of them
		int firstFinal = Automaton.NO_STATE;
		int lineNumber = 0;
		String line;
		while ((line = br.readLine()) != null) {
			lineNumber++;
			if (blankPat.matcher(line).matches())
				continue;
			String[] f = fieldSplitPat.split(line.trim());
			switch (f.length) {
			case 1:
			case 2: {
				int state = parseState(f[0], name, lineNumber);
				double w = f.length == 2 ? parseWeight(f[1], name, lineNumber) : 0;
				a.setFinal(state, w);
				if (firstFinal == Automaton.NO_STATE)
					firstFinal = state;
				break;
			}
			case 4:
			case 5: {
				int from = parseState(f[0], name, lineNumber);
				int to = parseState(f[1], name, lineNumber);
				int ilabel = parseLabel(f[2], name, lineNumber);
				int olabel = parseLabel(f[3], name, lineNumber);
				double w = f.length == 5 ? parseWeight(f[4], name, lineNumber) : 0;
				if (a.isEmpty())
					a.setStartState(from);
				a.addArc(new Arc(from, to, ilabel, olabel, w));
				break;
			}
			default:
				throw new DataFormatException(name, lineNumber, "expected an arc (4 or 5 fields) or a final state (1 or 2 fields) but got "+f.length+" fields");
			}
		}
		if (a.isEmpty() && firstFinal != Automaton.NO_STATE)
			a.setStartState(firstFinal);
		return a;
	}

	private int parseState(String s, String name, int lineNumber) throws DataFormatException {
		int state;
		try {
			state = Integer.parseInt(s);
		}
		catch (NumberFormatException e) {
			throw new DataFormatException(name, lineNumber, "bad state id "+s);
		}
		if (state < 0)
			throw new DataFormatException(name, lineNumber, "negative state id "+s);
		return state;
	}

	private int parseLabel(String s, String name, int lineNumber) throws DataFormatException {
		try {
			return Integer.parseInt(s);
		}
		catch (NumberFormatException e) {
			throw new DataFormatException(name, lineNumber, "bad label "+s);
		}
	}

	private double parseWeight(String s, String name, int lineNumber) throws DataFormatException {
		try {
			if (SparseWeight.isSparse(s))
				return SparseWeight.parse(s).get(weightKey);
			return Double.parseDouble(s);
		}
		catch (NumberFormatException e) {
			throw new DataFormatException(name, lineNumber, "bad weight "+s);
		}
		catch (DataFormatException e) {
			throw new DataFormatException(name, lineNumber, e.getMessage());
		}
	}
}
