package kohonen.som.kernel;

import kohonen.som.decay.DecayFunction;
import kohonen.som.decay.ExponentialDecay;
import kohonen.som.grid.GridPos;

public class GaussKernel implements KernelFunction {

	private static final double MIN_SIGMA = Math.pow(10, -127);

	private DecayFunction df;

	// width decays exponentially from initialWidth
	public GaussKernel(double initialWidth) {
		this(new ExponentialDecay(initialWidth));
	}

	public GaussKernel(DecayFunction df) {
		this.df = df;
	}

	@Override
	public double getValue(GridPos bmu, int t, int tMax, GridPos pos) {
		double sigma = Math.max(df.getValue(t, tMax), MIN_SIGMA);
		double d = bmu.dist(pos);
		return Math.exp(-(d * d) / (2 * sigma * sigma));
	}
}
