package kohonen.som.decay;

public class ConstantDecay implements DecayFunction {

	private double c;

	// no restraint
	public ConstantDecay() {
		this(1);
	}

	public ConstantDecay(double c) {
		this.c = c;
	}

	@Override
	public double getValue(int t, int tMax) {
		return c;
	}
}
