package kohonen.som.bmu;

import java.util.Collections;
import java.util.Set;

import kohonen.som.grid.Grid2D;
import kohonen.som.grid.GridPos;
import kohonen.som.grid.Neuron;

/**
 * Picks the best matching unit from the distances currently stored in the neurons.
 */
public abstract class BmuGetter {

	public Neuron getBmu(Grid2D grid) {
		return getBmu(grid, Collections.<GridPos>emptySet());
	}

	public abstract Neuron getBmu(Grid2D grid, Set<GridPos> ign);
}
