package kohonen.som.decay;

/**
 * Scalar schedule over the training run, used as learning rate (restraint) and as
 * neighborhood width.
 */
@FunctionalInterface
public interface DecayFunction {

	/**
	 * @param t current iteration, in [0, tMax)
	 * @param tMax total number of iterations
	 */
	public double getValue(int t, int tMax);
}
