package kohonen.som.select;

import kohonen.utils.DataSet;

// one pass in stored order
public class SequentialSelector implements Selector {

	private DataSet ds;
	private int idx;

	@Override
	public void init(DataSet ds) {
		this.ds = ds;
		this.idx = 0;
	}

	@Override
	public double[] next() {
		if( ds == null || idx >= ds.size() )
			throw new NoDataLeftException();
		return ds.get(idx++);
	}
}
