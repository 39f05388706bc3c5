package kohonen.som.select;

import java.util.Random;

import org.apache.commons.math3.util.MathArrays;

import kohonen.utils.DataSet;
import kohonen.utils.RandomSource;

/**
 * Endless random selection. Every cycle of size() calls returns each sample exactly
 * once, then a new permutation is drawn.
 */
public class RandomSelector implements Selector {

	private Random r;
	private DataSet ds;
	private int[] perm;
	private int idx;

	public RandomSelector() {
		this(RandomSource.get());
	}

	public RandomSelector(Random r) {
		this.r = r;
	}

	@Override
	public void init(DataSet ds) {
		this.ds = ds;
		this.perm = permutation(ds.size());
		this.idx = 0;
	}

	@Override
	public double[] next() {
		if( ds == null || ds.isEmpty() )
			throw new NoDataLeftException();

		if( idx == perm.length ) {
			perm = permutation(ds.size());
			idx = 0;
		}
		return ds.get(perm[idx++]);
	}

	private int[] permutation(int n) {
		int[] p = MathArrays.natural(n);
		for( int i = n - 1; i > 0; i-- ) {
			int j = r.nextInt(i + 1);
			int tmp = p[i];
			p[i] = p[j];
			p[j] = tmp;
		}
		return p;
	}
}
