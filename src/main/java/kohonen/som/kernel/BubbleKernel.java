package kohonen.som.kernel;

import kohonen.som.grid.GridPos;

/**
 * Constant influence within a radius that shrinks from r towards r/2 over the run.
 */
public class BubbleKernel implements KernelFunction {

	private double radius;

	public BubbleKernel(double radius) {
		this.radius = radius;
	}

	public double getRadius(int t, int tMax) {
		return radius / (1 + (double) t / tMax);
	}

	@Override
	public double getValue(GridPos bmu, int t, int tMax, GridPos pos) {
		if( bmu.dist(pos) <= getRadius(t, tMax) )
			return 1;
		else
			return 0;
	}
}
