package edu.isi.trellis;

import org.slf4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FilenameFilter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds and reads the automata of a decoding run on disk:
 * <ul>
 * <li>lattices at <code>&lt;path&gt;/&lt;index&gt;.fst</code>, or the path itself
 * formatted with the index if it contains <code>%d</code></li>
 * <li>rtn roots at <code>&lt;path&gt;/&lt;index&gt;.fst</code>, or the single file in
 * <code>&lt;path&gt;/&lt;index&gt;/</code> that starts with the root prefix</li>
 * <li>rtn sub automata at <code>&lt;path&gt;/&lt;index&gt;/&lt;nonterminal&gt;.fst</code></li>
 * <li>the nonterminal map at <code>&lt;path&gt;/ntmap</code></li>
 * </ul>
 * Indices handed to the store are 0-based, file names are 1-based.
 */
public class AutomatonStore {
	public static final String SUFFIX = ".fst";
	public static final String NTMAP = "ntmap";
	public static final int DEFAULT_START_NONTERMINAL = 1;

	// "name id" with optional surrounding white space
	private static Pattern ntmapLinePat = Pattern.compile("\\s*(\\S+)\\s+(\\S+)\\s*");

	private final String path;
	private final AutomatonReader reader;
	private final Logger log;

	public AutomatonStore(String path, AutomatonReader reader, Logger log) {
		this.path = path;
		this.reader = reader;
		this.log = log;
	}

	public String getPath() {
		return path;
	}

	public File getLatticeFile(int sequenceIndex) {
		int idx = sequenceIndex+1;
		if (path.contains("%d"))
			return new File(String.format(path, idx));
		return new File(path, idx+SUFFIX);
	}

	public Automaton load(int sequenceIndex) throws IOException, DataFormatException {
		return read(getLatticeFile(sequenceIndex));
	}

	public Automaton read(File f) throws IOException, DataFormatException {
		if (!f.canRead())
			throw new FileNotFoundException("Cannot read automaton "+f.getPath());
		Automaton a = reader.read(f);
		log.debug("Read automaton from {}: {} states, {} arcs", f.getPath(), a.getNumStates(), a.getNumArcs());
		return a;
	}

	// the root is a file of its own, or the file in the sequence directory
	// with the root prefix. Several candidates: take the lexicographically
	// last, which is the one with the largest span
	public File resolveRtnRoot(int sequenceIndex, final String rootPrefix) throws FileNotFoundException {
		int idx = sequenceIndex+1;
		File direct = new File(path, idx+SUFFIX);
		if (direct.canRead())
			return direct;
		File dir = new File(path, Integer.toString(idx));
		String[] candidates = dir.list(new FilenameFilter() {
			public boolean accept(File d, String name) {
				return name.startsWith(rootPrefix) && name.endsWith(SUFFIX);
			}
		});
		String pattern = new File(dir, rootPrefix+"*"+SUFFIX).getPath();
		if (candidates == null || candidates.length == 0)
			throw new FileNotFoundException("Could not find root automaton in "+pattern);
		Arrays.sort(candidates);
		if (candidates.length > 1)
			log.warn("Ambiguous root automaton for {}. Take the one with largest span: {}", pattern, candidates[candidates.length-1]);
		return new File(dir, candidates[candidates.length-1]);
	}

	public File getSubAutomatonFile(int sequenceIndex, int nonterminal) {
		return new File(new File(path, Integer.toString(sequenceIndex+1)), nonterminal+SUFFIX);
	}

	public Automaton loadSubAutomaton(int sequenceIndex, int nonterminal) throws IOException, DataFormatException {
		return read(getSubAutomatonFile(sequenceIndex, nonterminal));
	}

	// numeric id of startSymbol according to the ntmap. Anything missing or
	// unreadable falls back to nonterminal 1
	public int readStartNonterminal(String startSymbol) {
		File f = new File(path, NTMAP);
		BufferedReader br = null;
		try {
			br = new BufferedReader(new InputStreamReader(new FileInputStream(f), StandardCharsets.UTF_8));
			String line;
			while ((line = br.readLine()) != null) {
				Matcher m = ntmapLinePat.matcher(line);
				if (m.matches() && m.group(1).equals(startSymbol))
					return Integer.parseInt(m.group(2));
			}
			log.warn("Could not find nonterminal {} in {}. Assuming its ID is {}", startSymbol, f.getPath(), DEFAULT_START_NONTERMINAL);
		}
		catch (IOException e) {
			log.warn("Could not read {} ({}). Assuming ID {} for nonterminal {}", f.getPath(), e.getMessage(), DEFAULT_START_NONTERMINAL, startSymbol);
		}
		catch (NumberFormatException e) {
			log.warn("Bad ID for nonterminal {} in {}. Assuming its ID is {}", startSymbol, f.getPath(), DEFAULT_START_NONTERMINAL);
		}
		finally {
			if (br != null) {
				try {
					br.close();
				}
				catch (IOException e) {
					log.debug("Could not close {}", f.getPath(), e);
				}
			}
		}
		return DEFAULT_START_NONTERMINAL;
	}

	// file name prefix of the root automaton of nonterminal startId: a one,
	// the zero padded nonterminal, and the span start 000
	public static String rootPrefix(int startId) {
		return String.format("1%03d000", startId);
	}
}
