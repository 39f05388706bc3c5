package kohonen.som.net;

import java.util.Arrays;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.log4j.Logger;

import kohonen.dist.Dist;
import kohonen.dist.EuclideanDist;
import kohonen.som.adapt.IdentityAdapter;
import kohonen.som.adapt.InputAdapter;
import kohonen.som.bmu.BmuGetter;
import kohonen.som.bmu.DefaultBmuGetter;
import kohonen.som.decay.ConstantDecay;
import kohonen.som.decay.DecayFunction;
import kohonen.som.grid.Grid2D;
import kohonen.som.grid.GridPos;
import kohonen.som.grid.Neuron;
import kohonen.som.init.NeuronsInitializer;
import kohonen.som.init.ZeroInitializer;
import kohonen.som.kernel.BmuOnlyKernel;
import kohonen.som.kernel.KernelFunction;
import kohonen.som.select.NoDataLeftException;
import kohonen.som.select.SequentialSelector;
import kohonen.som.select.Selector;
import kohonen.utils.DataSet;

/**
 * Self-organizing map on a rectangular grid.
 * <p>
 * All policies are replaceable between training runs. Not thread-safe: {@link #learn}
 * and {@link #test} write the neurons' weights and scratch distances.
 */
public class SOM {

	private static Logger log = Logger.getLogger(SOM.class);

	protected Grid2D grid;
	protected NeuronsInitializer initializer = new ZeroInitializer();
	protected Selector selector = new SequentialSelector();
	protected DecayFunction lr = new ConstantDecay();
	protected KernelFunction nb = new BmuOnlyKernel();
	protected Dist<double[]> dist = new EuclideanDist();
	protected InputAdapter adapter = new IdentityAdapter();
	protected BmuGetter bmuGetter = new DefaultBmuGetter();

	public SOM(int xSize, int ySize) {
		this(new Grid2D(xSize, ySize));
	}

	public SOM(Grid2D grid) {
		this.grid = grid;
	}

	/**
	 * Initializes the neurons and trains the map.
	 *
	 * @return the number of completed iterations, less than iterations if the selector ran dry
	 */
	public int learn(DataSet ds, int iterations) {
		initializer.init(ds, grid);
		selector.init(ds);

		long time = System.currentTimeMillis();
		int t = 0;
		for( ; t < iterations; t++ ) {
			double[] x;
			try {
				x = selector.next();
			} catch( NoDataLeftException e ) {
				log.debug("Selector exhausted after " + t + " of " + iterations + " iterations");
				break;
			}
			train(t, iterations, x);
		}
		log.debug("Trained " + t + " iterations on " + grid.getXSize() + "x" + grid.getYSize() + " grid, took: " + (System.currentTimeMillis() - time) + "ms");
		return t;
	}

	/**
	 * One competitive learning step with input x at iteration t of tMax.
	 */
	public void train(int t, int tMax, double[] x) {
		double[] v = adapt(x);
		computeDistances(v);
		GridPos bmuPos = bmuGetter.getBmu(grid).getPos();

		double alpha = lr.getValue(t, tMax);
		for( Neuron n : grid.getNeurons() ) {
			double theta = nb.getValue(bmuPos, t, tMax, n.getPos());
			double c = alpha * theta;
			if( c == 0 )
				continue;

			double[] w = n.getWeights();
			for( int j = 0; j < w.length; j++ )
				w[j] = w[j] + c * (v[j] - w[j]);
		}
	}

	/**
	 * Finds the BMU of x. Overwrites the scratch distance of every neuron.
	 */
	public Neuron test(double[] x) {
		if( !grid.getNeuron(0, 0).isInitialized() )
			log.warn("Testing against uninitialized grid");
		computeDistances(adapt(x));
		return bmuGetter.getBmu(grid);
	}

	/**
	 * Distances from x to every neuron, indexed [x][y]. Leaves the neurons untouched.
	 */
	public double[][] computeDistanceMatrix(double[] x) {
		double[] v = adapt(x);
		double[][] m = new double[grid.getXSize()][grid.getYSize()];
		for( Neuron n : grid.getNeurons() )
			m[n.getX()][n.getY()] = distTo(n, v);
		return m;
	}

	/**
	 * Weights split per dimension, indexed [k][x][y].
	 */
	public double[][][] separateWeights() {
		int width = grid.getWeightWidth();
		double[][][] s = new double[width][grid.getXSize()][grid.getYSize()];
		for( Neuron n : grid.getNeurons() ) {
			double[] w = n.getWeights();
			for( int k = 0; k < width; k++ )
				s[k][n.getX()][n.getY()] = w[k];
		}
		return s;
	}

	protected void computeDistances(double[] v) {
		for( Neuron n : grid.getNeurons() )
			n.setDistance(distTo(n, v));
	}

	// uninitialized neurons are at distance 0
	private double distTo(Neuron n, double[] v) {
		double[] w = n.getWeights();
		if( w.length == 0 )
			return 0;
		if( w.length != v.length )
			throw new DimensionMismatchException(v.length, w.length);
		return dist.dist(v, w);
	}

	// adapters may work in place, so never hand them the caller's array
	private double[] adapt(double[] x) {
		return adapter.adapt(Arrays.copyOf(x, x.length));
	}

	public Grid2D getGrid() {
		return grid;
	}

	public Neuron getNeuron(int x, int y) {
		return grid.getNeuron(x, y);
	}

	public NeuronsInitializer getInitializer() {
		return initializer;
	}

	public void setInitializer(NeuronsInitializer initializer) {
		this.initializer = initializer;
	}

	public Selector getSelector() {
		return selector;
	}

	public void setSelector(Selector selector) {
		this.selector = selector;
	}

	public DecayFunction getRestraint() {
		return lr;
	}

	public void setRestraint(DecayFunction lr) {
		this.lr = lr;
	}

	public KernelFunction getInfluence() {
		return nb;
	}

	public void setInfluence(KernelFunction nb) {
		this.nb = nb;
	}

	public Dist<double[]> getDistance() {
		return dist;
	}

	public void setDistance(Dist<double[]> dist) {
		this.dist = dist;
	}

	public InputAdapter getAdapter() {
		return adapter;
	}

	public void setAdapter(InputAdapter adapter) {
		this.adapter = adapter;
	}

	public BmuGetter getBmuGetter() {
		return bmuGetter;
	}

	public void setBmuGetter(BmuGetter bmuGetter) {
		this.bmuGetter = bmuGetter;
	}
}
