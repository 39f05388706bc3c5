package kohonen.som.decay;

// From Ritter, Martinetz and Schulten
public class PowerDecay implements DecayFunction {

	private double from, to;

	public PowerDecay(double from, double to) {
		if( from <= 0 || to <= 0 )
			throw new IllegalArgumentException("Bounds must be positive: " + from + ", " + to);
		this.from = from;
		this.to = to;
	}

	@Override
	public double getValue(int t, int tMax) {
		return from * Math.pow(to / from, (double) t / tMax);
	}
}
