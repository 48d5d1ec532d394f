package edu.isi.trellis;

// the automaton predictors by their command line names
public enum PredictorType { FST, NFST, RTN ;
	private static final String list;
	public static final String getList() { return list;}
	static {
		StringBuffer sb = new StringBuffer();
		for (PredictorType x: PredictorType.values()) {
			sb.append(x.getName()+" ");
		}
		list = sb.toString();
	}

	public String getName() {
		return toString().toLowerCase();
	}

	public static PredictorType get(String s) throws ConfigureException {
		for (PredictorType x : PredictorType.values()) {
			if (x.getName().equals(s) || x.toString().equals(s))
				return x;
		}
		throw new ConfigureException("Invalid predictor type ("+s+"); valid values are "+list);
	}

	public Predictor create(PredictorConfig config) {
		switch (this) {
		case FST:
			return new DeterministicLatticePredictor(config);
		case NFST:
			return new NondeterministicLatticePredictor(config);
		default:
			return new RtnPredictor(config);
		}
	}
}
