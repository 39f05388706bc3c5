package kohonen.som.decay;

public class LinearDecay implements DecayFunction {

	private double from, to;

	public LinearDecay(double from, double to) {
		this.from = from;
		this.to = to;
	}

	@Override
	public double getValue(int t, int tMax) {
		return (to - from) * ((double) t / tMax) + from;
	}
}
