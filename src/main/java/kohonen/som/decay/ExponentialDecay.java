package kohonen.som.decay;

/**
 * rate * exp(-t/tMax), or rate * exp(-t/n) if a fixed denominator n is given.
 */
public class ExponentialDecay implements DecayFunction {

	private double rate, n;

	public ExponentialDecay(double rate) {
		this.rate = rate;
		this.n = -1;
	}

	public ExponentialDecay(double rate, double n) {
		if( n <= 0 )
			throw new IllegalArgumentException("Denominator must be positive: " + n);
		this.rate = rate;
		this.n = n;
	}

	@Override
	public double getValue(int t, int tMax) {
		double d = n > 0 ? n : tMax;
		return rate * Math.exp(-t / d);
	}
}
