package edu.isi.trellis;

import gnu.trove.map.hash.TIntDoubleHashMap;

/**
 * A weight map shared by several predictors reading the same automaton. The
 * text form is a flat list <code>default,k1,v1,k2,v2,...</code>: the leading
 * value is stored under the reserved key 0 and is used for every key that is
 * not listed.
 */
public class SparseWeight {
	public static final int DEFAULT_KEY = 0;

	private final TIntDoubleHashMap values;

	private SparseWeight(TIntDoubleHashMap values) {
		this.values = values;
	}

	public static boolean isSparse(String field) {
		return field.indexOf(',') >= 0;
	}

	public static SparseWeight parse(String field) throws DataFormatException {
		String[] toks = field.split(",");
		if (toks.length % 2 == 0)
			throw new DataFormatException("Sparse weight "+field+" must be a default value followed by key/value pairs");
		TIntDoubleHashMap values = new TIntDoubleHashMap();
		try {
			values.put(DEFAULT_KEY, Double.parseDouble(toks[0]));
			for (int i = 1; i < toks.length; i += 2) {
				int key = Integer.parseInt(toks[i].trim());
				if (key == DEFAULT_KEY)
					throw new DataFormatException("Key "+DEFAULT_KEY+" is reserved in sparse weight "+field);
				values.put(key, Double.parseDouble(toks[i+1]));
			}
		}
		catch (NumberFormatException e) {
			throw new DataFormatException("Bad number in sparse weight "+field, e);
		}
		return new SparseWeight(values);
	}

	public double get(int key) {
		if (values.containsKey(key))
			return values.get(key);
		return values.get(DEFAULT_KEY);
	}

	public int size() {
		return values.size();
	}
}
