package kohonen.som.init;

import kohonen.som.grid.Grid2D;
import kohonen.som.grid.Neuron;
import kohonen.utils.DataSet;

public class ZeroInitializer implements NeuronsInitializer {

	@Override
	public void init(DataSet ds, Grid2D grid) {
		int width = ds.width();
		for( Neuron n : grid.getNeurons() )
			n.setWeights(new double[width]);
	}
}
