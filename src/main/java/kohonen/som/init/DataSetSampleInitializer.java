package kohonen.som.init;

import java.util.Arrays;
import java.util.Random;

import org.apache.log4j.Logger;

import kohonen.som.grid.Grid2D;
import kohonen.som.grid.Neuron;
import kohonen.som.select.RandomSelector;
import kohonen.utils.DataSet;
import kohonen.utils.RandomSource;

/**
 * Copies samples of the data set into the neurons. If there are more samples than
 * neurons, the samples are sorted and downsampled first, so that each chosen sample
 * represents a band of similar samples.
 */
public class DataSetSampleInitializer implements NeuronsInitializer {

	private static Logger log = Logger.getLogger(DataSetSampleInitializer.class);

	private Random r;

	public DataSetSampleInitializer() {
		this(RandomSource.get());
	}

	public DataSetSampleInitializer(Random r) {
		this.r = r;
	}

	@Override
	public void init(DataSet ds, Grid2D grid) {
		new ZeroInitializer().init(ds, grid);

		DataSet samples = ds;
		if( grid.size() < ds.size() ) {
			samples = ds.copy();
			samples.sortLexicographic();
			samples.downsample(grid.size());
			log.debug("Reduced " + ds.size() + " samples to " + samples.size() + " representatives");
		}

		RandomSelector rs = new RandomSelector(r);
		rs.init(samples);
		for( Neuron n : grid.getNeurons() ) {
			double[] d = rs.next();
			n.setWeights(Arrays.copyOf(d, d.length));
		}
	}
}
