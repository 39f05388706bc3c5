package kohonen.som.select;

import kohonen.utils.DataSet;

/**
 * Yields the training samples of a run, one per iteration.
 */
public interface Selector {

	public void init(DataSet ds);

	/**
	 * @throws NoDataLeftException if there is nothing left to select
	 */
	public double[] next();
}
