package kohonen.som.init;

import kohonen.som.grid.Grid2D;
import kohonen.utils.DataSet;

/**
 * Sets the initial weights of all neurons. Runs before anything else in a training run.
 */
public interface NeuronsInitializer {
	public void init(DataSet ds, Grid2D grid);
}
