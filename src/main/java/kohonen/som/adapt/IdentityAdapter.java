package kohonen.som.adapt;

public class IdentityAdapter implements InputAdapter {

	@Override
	public double[] adapt(double[] d) {
		return d;
	}
}
