package kohonen.som.kernel;

import kohonen.som.grid.GridPos;

/**
 * Neighborhood function. Tells how much the neuron at pos moves towards the input,
 * given the position of the BMU and the training progress.
 */
@FunctionalInterface
public interface KernelFunction {
	public double getValue(GridPos bmu, int t, int tMax, GridPos pos);
}
