package kohonen.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;

/**
 * In-memory collection of equally wide numeric samples.
 */
public class DataSet {

	public static final Comparator<double[]> LEXICOGRAPHIC = (a, b) -> {
		int n = Math.min(a.length, b.length);
		for( int i = 0; i < n; i++ ) {
			int c = Double.compare(a[i], b[i]);
			if( c != 0 )
				return c;
		}
		return Integer.compare(a.length, b.length);
	};

	private List<double[]> samples;

	public DataSet() {
		this.samples = new ArrayList<>();
	}

	public void add(double[] d) {
		if( !samples.isEmpty() && width() != d.length )
			throw new DimensionMismatchException(d.length, width());
		samples.add(d);
	}

	public void addRaw(double... d) {
		add(d);
	}

	public double[] get(int i) {
		return samples.get(i);
	}

	public List<double[]> getVectors() {
		return Collections.unmodifiableList(samples);
	}

	public int size() {
		return samples.size();
	}

	public boolean isEmpty() {
		return samples.isEmpty();
	}

	public int width() {
		if( samples.isEmpty() )
			throw new NoDataException();
		return samples.get(0).length;
	}

	public void shuffle() {
		shuffle(RandomSource.get());
	}

	public void shuffle(Random r) {
		Collections.shuffle(samples, r);
	}

	public DataSet copy() {
		DataSet ds = new DataSet();
		for( double[] d : samples )
			ds.samples.add(Arrays.copyOf(d, d.length));
		return ds;
	}

	// List.sort is stable
	public void sortLexicographic() {
		samples.sort(LEXICOGRAPHIC);
	}

	/**
	 * Keeps one sample per contiguous segment, the one in the middle of the segment.
	 * Does nothing if there are at most n samples.
	 */
	public void downsample(int n) {
		if( n <= 0 )
			throw new IllegalArgumentException("Number of samples must be positive: " + n);
		if( samples.size() <= n )
			return;

		double step = (double) samples.size() / n;
		List<double[]> l = new ArrayList<>(n);
		for( int i = 0; i < n; i++ ) {
			int left = (int) Math.floor(i * step);
			int right = (int) Math.floor((i + 1) * step);
			l.add(samples.get((left + right) >> 1));
		}
		samples = l;
	}

	@Override
	public String toString() {
		return "DataSet[size=" + samples.size() + (samples.isEmpty() ? "" : ", width=" + width()) + "]";
	}
}
