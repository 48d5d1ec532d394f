package edu.isi.trellis;

// settings shared by the automaton predictors. Setters chain
public class PredictorConfig {
	public static final int DEFAULT_BOS_ID = 1;
	public static final int DEFAULT_EOS_ID = 2;
	public static final int DEFAULT_UNK_ID = 3;

	// automaton base directory, or a file name template containing %d
	private String path;
	// false: every reachable symbol scores 0
	private boolean useWeights = true;
	// renormalize scores so that probabilities sum to one
	private boolean normalizeScores = false;
	// false: the begin marker weight is carried (added to the end marker by
	// the deterministic predictor, kept in the frontier by the nondeterministic one)
	private boolean skipBosWeight = true;
	// weights on disk are costs; true negates them into log probabilities
	private boolean toLog = true;
	// rtn only
	private boolean removeEpsilons = true;
	private boolean minimize = false;
	private String startSymbol = "S";
	private int maxExpansionPasses = 1000;
	private int maxDeterminizedStates = 1000000;

	private int bosId = DEFAULT_BOS_ID;
	private int eosId = DEFAULT_EOS_ID;
	private int unkId = DEFAULT_UNK_ID;
	private int weightKey = SparseWeight.DEFAULT_KEY;

	public PredictorConfig(String path) {
		setPath(path);
	}

	public String getPath() { return path; }
	public boolean useWeights() { return useWeights; }
	public boolean normalizeScores() { return normalizeScores; }
	public boolean skipBosWeight() { return skipBosWeight; }
	public boolean toLog() { return toLog; }
	public boolean removeEpsilons() { return removeEpsilons; }
	public boolean minimize() { return minimize; }
	public String getStartSymbol() { return startSymbol; }
	public int getMaxExpansionPasses() { return maxExpansionPasses; }
	public int getMaxDeterminizedStates() { return maxDeterminizedStates; }
	public int getBosId() { return bosId; }
	public int getEosId() { return eosId; }
	public int getUnkId() { return unkId; }
	public int getWeightKey() { return weightKey; }

	public PredictorConfig setPath(String p) {
		if (p == null)
			throw new IllegalArgumentException("Automaton path must be set");
		path = p;
		return this;
	}
	public PredictorConfig setUseWeights(boolean b) { useWeights = b; return this; }
	public PredictorConfig setNormalizeScores(boolean b) { normalizeScores = b; return this; }
	public PredictorConfig setSkipBosWeight(boolean b) { skipBosWeight = b; return this; }
	public PredictorConfig setToLog(boolean b) { toLog = b; return this; }
	public PredictorConfig setRemoveEpsilons(boolean b) { removeEpsilons = b; return this; }
	public PredictorConfig setMinimize(boolean b) { minimize = b; return this; }
	public PredictorConfig setStartSymbol(String s) {
		if (s == null || s.trim().length() == 0)
			throw new IllegalArgumentException("Start symbol must not be empty");
		startSymbol = s;
		return this;
	}
	public PredictorConfig setMaxExpansionPasses(int i) {
		maxExpansionPasses = positive("maxExpansionPasses", i);
		return this;
	}
	public PredictorConfig setMaxDeterminizedStates(int i) {
		maxDeterminizedStates = positive("maxDeterminizedStates", i);
		return this;
	}
	public PredictorConfig setBosId(int i) { bosId = symbol("bos", i); return this; }
	public PredictorConfig setEosId(int i) { eosId = symbol("eos", i); return this; }
	public PredictorConfig setUnkId(int i) { unkId = symbol("unk", i); return this; }
	public PredictorConfig setWeightKey(int i) {
		if (i < 0)
			throw new IllegalArgumentException("Weight key must not be negative: "+i);
		weightKey = i;
		return this;
	}

	// the score domain the predictors combine in
	public Semiring getScoreSemiring() {
		if (toLog)
			return new MaxTropicalSemiring();
		return new TropicalSemiring();
	}

	private static int positive(String name, int i) {
		if (i <= 0)
			throw new IllegalArgumentException(name+" must be positive: "+i);
		return i;
	}

	private static int symbol(String name, int i) {
		if (i == Arc.EPSILON)
			throw new IllegalArgumentException(name+" id "+i+" is the epsilon label");
		return i;
	}

	public String toString() {
		return "path="+path+" useWeights="+useWeights+" normalize="+normalizeScores+
			" skipBosWeight="+skipBosWeight+" toLog="+toLog+" rmeps="+removeEpsilons+
			" minimize="+minimize+" bos="+bosId+" eos="+eosId+" unk="+unkId+" weightKey="+weightKey;
	}
}
