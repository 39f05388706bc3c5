package kohonen.som.bmu;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

import kohonen.som.grid.Grid2D;
import kohonen.som.grid.GridPos;
import kohonen.som.grid.Neuron;
import kohonen.utils.RandomSource;

/**
 * Minimum stored distance wins. Ties are broken uniformly at random.
 */
public class DefaultBmuGetter extends BmuGetter {

	private Random r;

	public DefaultBmuGetter() {
		this(RandomSource.get());
	}

	public DefaultBmuGetter(Random r) {
		this.r = r;
	}

	@Override
	public Neuron getBmu(Grid2D grid, Set<GridPos> ign) {
		List<Neuron> candidates = new ArrayList<>(2);
		double dist = Double.NaN;

		// seeded with the first neuron, so NaN distances still yield a bmu; any number beats NaN
		for( Neuron n : grid.getNeurons() ) {
			if( ign != null && ign.contains(n.getPos()) )
				continue;

			double d = n.getDistance();
			if( candidates.isEmpty() || d < dist || (Double.isNaN(dist) && !Double.isNaN(d)) ) {
				dist = d;
				candidates.clear();
				candidates.add(n);
			} else if( d == dist )
				candidates.add(n);
		}

		if( candidates.isEmpty() )
			throw new IllegalStateException("No bmu found, all positions ignored");

		if( candidates.size() == 1 )
			return candidates.get(0);
		return candidates.get(r.nextInt(candidates.size()));
	}
}
