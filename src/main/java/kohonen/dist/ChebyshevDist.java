package kohonen.dist;

import org.apache.commons.math3.exception.DimensionMismatchException;

// maximum metric
public class ChebyshevDist implements Dist<double[]> {

	@Override
	public double dist(double[] a, double[] b) {
		if( a.length != b.length )
			throw new DimensionMismatchException(b.length, a.length);

		double d = 0;
		for( int i = 0; i < a.length; i++ )
			d = Math.max(d, Math.abs(a[i] - b[i]));
		return d;
	}
}
