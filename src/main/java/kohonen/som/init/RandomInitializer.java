package kohonen.som.init;

import java.util.Random;

import kohonen.som.grid.Grid2D;
import kohonen.som.grid.Neuron;
import kohonen.utils.DataSet;
import kohonen.utils.RandomSource;

// uniform in [0,1)
public class RandomInitializer implements NeuronsInitializer {

	private Random r;

	public RandomInitializer() {
		this(RandomSource.get());
	}

	public RandomInitializer(Random r) {
		this.r = r;
	}

	@Override
	public void init(DataSet ds, Grid2D grid) {
		new ZeroInitializer().init(ds, grid);
		for( Neuron n : grid.getNeurons() ) {
			double[] w = n.getWeights();
			for( int i = 0; i < w.length; i++ )
				w[i] = r.nextDouble();
		}
	}
}
