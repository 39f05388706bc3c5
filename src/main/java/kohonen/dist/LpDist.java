package kohonen.dist;

import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * Minkowski distance of order p. p = 1 is the Manhattan, p = 2 the Euclidean distance.
 */
public class LpDist implements Dist<double[]> {

	private double p;

	public LpDist(double p) {
		if( p < 1 )
			throw new IllegalArgumentException("Order must be >= 1: " + p);
		this.p = p;
	}

	@Override
	public double dist(double[] a, double[] b) {
		if( a.length != b.length )
			throw new DimensionMismatchException(b.length, a.length);

		double d = 0;
		for( int i = 0; i < a.length; i++ )
			d += Math.pow(Math.abs(a[i] - b[i]), p);
		return Math.pow(d, 1.0 / p);
	}
}
