package kohonen.som.adapt;

import java.util.Arrays;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import kohonen.utils.DataSet;

/**
 * Scales every coordinate to [0,1] by the given minima and maxima. Works in place.
 * Coordinates with equal minimum and maximum map to 0.
 */
public class MinMaxAdapter implements InputAdapter {

	private double[] min, max;

	public MinMaxAdapter(double[] min, double[] max) {
		if( min.length != max.length )
			throw new DimensionMismatchException(max.length, min.length);
		this.min = Arrays.copyOf(min, min.length);
		this.max = Arrays.copyOf(max, max.length);
	}

	// minima and maxima of the samples
	public static MinMaxAdapter of(DataSet ds) {
		int width = ds.width();
		SummaryStatistics[] ss = new SummaryStatistics[width];
		for( int i = 0; i < width; i++ )
			ss[i] = new SummaryStatistics();
		for( double[] d : ds.getVectors() )
			for( int i = 0; i < width; i++ )
				ss[i].addValue(d[i]);

		double[] min = new double[width];
		double[] max = new double[width];
		for( int i = 0; i < width; i++ ) {
			min[i] = ss[i].getMin();
			max[i] = ss[i].getMax();
		}
		return new MinMaxAdapter(min, max);
	}

	@Override
	public double[] adapt(double[] d) {
		if( d.length != min.length )
			throw new DimensionMismatchException(d.length, min.length);
		for( int i = 0; i < d.length; i++ ) {
			double range = max[i] - min[i];
			d[i] = range == 0 ? 0 : (d[i] - min[i]) / range;
		}
		return d;
	}

	public double[] getMin() {
		return Arrays.copyOf(min, min.length);
	}

	public double[] getMax() {
		return Arrays.copyOf(max, max.length);
	}
}
