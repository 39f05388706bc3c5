package kohonen.som.adapt;

/**
 * Preprocessing applied to every input before it reaches the grid.
 */
@FunctionalInterface
public interface InputAdapter {
	public double[] adapt(double[] d);
}
