package kohonen.som.decay;

// a / (b + t)
public class SimpleDecay implements DecayFunction {

	private double a, b;

	public SimpleDecay(double a, double b) {
		this.a = a;
		this.b = b;
	}

	@Override
	public double getValue(int t, int tMax) {
		return a / (b + t);
	}
}
