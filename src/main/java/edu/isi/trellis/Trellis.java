package edu.isi.trellis;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;
import gnu.trove.map.hash.TIntDoubleHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Iterator;

/**
 * Command line driver: loads the automaton of one sentence with one of the
 * predictors and walks it along a symbol sequence, printing the predicted
 * distribution before each symbol and the weight each symbol was consumed with.
 */
public class Trellis {
	static final String VERSION = "1.0";

	private static final Logger log = LoggerFactory.getLogger(Trellis.class);

	private static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
				"print this help message");
		jsap.registerParameter(helpsw);

		// WHAT TO LOAD

		FlaggedOption predopt = new FlaggedOption("predictor",
				EnumeratedStringParser.getParser(PredictorType.getList().trim().replace(" ", "; ")),
				"fst",
				true,
				'p',
				"predictor",
				"type of predictor: fst (deterministic lattice), nfst (lattice with epsilons "+
				"or ambiguous arcs) or rtn (recursive transition network)");
		jsap.registerParameter(predopt);

		FlaggedOption pathopt = new FlaggedOption("path",
				StringStringParser.getParser(),
				null,
				true,
				'f',
				"path",
				"directory holding <index>.fst files, or a file name containing %d that is "+
				"filled with the index");
		jsap.registerParameter(pathopt);

		FlaggedOption indexopt = new FlaggedOption("index",
				IntegerStringParser.getParser(),
				"1",
				true,
				'i',
				"index",
				"1-based index of the sentence whose automaton is used");
		jsap.registerParameter(indexopt);

		// HOW TO SCORE

		Switch noweightsw = new Switch("noweights",
				JSAP.NO_SHORTFLAG,
				"no-weights",
				"score every reachable symbol with 0");
		jsap.registerParameter(noweightsw);

		Switch normsw = new Switch("normalize",
				'n',
				"normalize",
				"renormalize the predicted scores so that their probabilities sum to one");
		jsap.registerParameter(normsw);

		Switch bostoeossw = new Switch("bostoeos",
				JSAP.NO_SHORTFLAG,
				"add-bos-to-eos",
				"keep the weight of the begin-of-sentence arc (added to the end-of-sentence "+
				"score, or kept in the frontier for nfst)");
		jsap.registerParameter(bostoeossw);

		Switch costsw = new Switch("cost",
				JSAP.NO_SHORTFLAG,
				"cost",
				"report weights as costs (smaller is better) instead of negating them into "+
				"log probabilities");
		jsap.registerParameter(costsw);

		FlaggedOption weightkeyopt = new FlaggedOption("weightkey",
				IntegerStringParser.getParser(),
				"0",
				false,
				JSAP.NO_SHORTFLAG,
				"weight-key",
				"key of the entry to use for sparse weights. 0 = the default entry");
		jsap.registerParameter(weightkeyopt);

		// RTN OPTIONS

		Switch normepssw = new Switch("normeps",
				JSAP.NO_SHORTFLAG,
				"no-rmeps",
				"rtn only: keep epsilon arcs in the expanded automaton");
		jsap.registerParameter(normepssw);

		Switch minsw = new Switch("minimize",
				JSAP.NO_SHORTFLAG,
				"minimize",
				"rtn only: determinize and minimize the expanded automaton");
		jsap.registerParameter(minsw);

		FlaggedOption startopt = new FlaggedOption("startsymbol",
				StringStringParser.getParser(),
				"S",
				false,
				JSAP.NO_SHORTFLAG,
				"start-symbol",
				"rtn only: name of the start nonterminal in <path>/ntmap");
		jsap.registerParameter(startopt);

		// SYMBOL IDS

		FlaggedOption bosopt = new FlaggedOption("bos",
				IntegerStringParser.getParser(),
				Integer.toString(PredictorConfig.DEFAULT_BOS_ID),
				true,
				JSAP.NO_SHORTFLAG,
				"bos",
				"id of the begin-of-sentence symbol");
		jsap.registerParameter(bosopt);

		FlaggedOption eosopt = new FlaggedOption("eos",
				IntegerStringParser.getParser(),
				Integer.toString(PredictorConfig.DEFAULT_EOS_ID),
				true,
				JSAP.NO_SHORTFLAG,
				"eos",
				"id of the end-of-sentence symbol");
		jsap.registerParameter(eosopt);

		FlaggedOption unkopt = new FlaggedOption("unk",
				IntegerStringParser.getParser(),
				Integer.toString(PredictorConfig.DEFAULT_UNK_ID),
				true,
				JSAP.NO_SHORTFLAG,
				"unk",
				"id of the unknown word symbol");
		jsap.registerParameter(unkopt);

		Switch heursw = new Switch("heuristic",
				'e',
				"heuristic",
				"print the estimated future cost of every symbol");
		jsap.registerParameter(heursw);

		// symbols are at the end for nice placement in the usage statement
		UnflaggedOption symopt = new UnflaggedOption("symbols",
				IntegerStringParser.getParser(),
				null,
				false,
				true,
				"ids of the symbols to consume after the begin-of-sentence symbol");
		jsap.registerParameter(symopt);

		JSAPResult config = jsap.parse(argv);
		if (!config.success() || config.getBoolean("help"))
			return config;

		// rtn options don't mean anything for lattices
		boolean rtn = PredictorType.get(config.getString("predictor")) == PredictorType.RTN;
		if (!rtn && (config.getBoolean("normeps") || config.getBoolean("minimize")))
			throw new ConfigureException("--no-rmeps and --minimize only apply to the rtn predictor");
		if (config.getBoolean("normeps") && config.getBoolean("minimize"))
			throw new ConfigureException("--minimize removes epsilons; it cannot be combined with --no-rmeps");
		if (config.getInt("index") < 1)
			throw new ConfigureException("Sentence index is 1-based; got "+config.getInt("index"));
		return config;
	}

	// settings of the predictor from the parsed options
	static PredictorConfig buildConfig(JSAPResult config) throws ConfigureException {
		try {
			return new PredictorConfig(config.getString("path"))
				.setUseWeights(!config.getBoolean("noweights"))
				.setNormalizeScores(config.getBoolean("normalize"))
				.setSkipBosWeight(!config.getBoolean("bostoeos"))
				.setToLog(!config.getBoolean("cost"))
				.setRemoveEpsilons(!config.getBoolean("normeps"))
				.setMinimize(config.getBoolean("minimize"))
				.setStartSymbol(config.getString("startsymbol"))
				.setBosId(config.getInt("bos"))
				.setEosId(config.getInt("eos"))
				.setUnkId(config.getInt("unk"))
				.setWeightKey(config.getInt("weightkey"));
		}
		catch (IllegalArgumentException e) {
			throw new ConfigureException(e.getMessage());
		}
	}

	// parses argv and walks the predictor. Returns the exit status
	static int run(String[] argv, PrintStream out, PrintStream err) {
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		PredictorType type = null;
		PredictorConfig pconfig = null;
		try {
			config = processParameters(jsap, argv);
			if (config.success() && !config.getBoolean("help")) {
				type = PredictorType.get(config.getString("predictor"));
				pconfig = buildConfig(config);
			}
		}
		catch (JSAPException e) {
			err.println("Trellis options improperly configured: "+e.getMessage());
			err.println("Try 'trellis -h' for a detailed help message");
			return 1;
		}
		catch (ConfigureException e) {
			err.println("Trellis options improperly configured: "+e.getMessage());
			err.println("Usage: trellis "+jsap.getUsage());
			return 1;
		}

		if (config.getBoolean("help")) {
			out.println("Usage: trellis ");
			out.println("             "+jsap.getUsage());
			out.println("");
			out.println(jsap.getHelp());
			out.println("Predictor types: "+PredictorType.getList().trim());
			return 0;
		}

		if (!config.success()) {
			for (Iterator errs = config.getErrorMessageIterator(); errs.hasNext();)
				err.println("Error: " + errs.next());
			err.println("Usage: trellis ");
			err.println("             "+jsap.getUsage());
			return 1;
		}

		int[] symbols = config.contains("symbols") ? config.getIntArray("symbols") : new int[0];
		int sequenceIndex = config.getInt("index")-1;
		boolean heuristic = config.getBoolean("heuristic");
		log.info("Trellis {}: {} predictor, {}", VERSION, type.getName(), pconfig);

		Predictor predictor = type.create(pconfig);
		predictor.initialize(sequenceIndex);
		if (heuristic)
			predictor.initializeHeuristic(sequenceIndex);
		for (int i = 0; i < symbols.length; i++) {
			out.println("predict "+i+": "+format(predictor.predictNext()));
			if (heuristic) {
				int[] hypo = Arrays.copyOf(symbols, i+1);
				out.println("future cost of "+symbols[i]+": "+predictor.estimateFutureCost(hypo));
			}
			double w = predictor.consume(symbols[i]);
			out.println("consume "+symbols[i]+": "+w);
		}
		out.println("predict "+symbols.length+": "+format(predictor.predictNext()));
		return 0;
	}

	// "{label:score, ...}" sorted by label
	static String format(TIntDoubleHashMap scores) {
		int[] keys = scores.keys();
		Arrays.sort(keys);
		StringBuffer sb = new StringBuffer("{");
		for (int i = 0; i < keys.length; i++) {
			if (i > 0)
				sb.append(", ");
			sb.append(keys[i]+":"+scores.get(keys[i]));
		}
		sb.append("}");
		return sb.toString();
	}

	public static void main(String argv[]) {
		System.exit(run(argv, System.out, System.err));
	}
}
