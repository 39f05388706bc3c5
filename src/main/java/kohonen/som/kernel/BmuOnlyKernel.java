package kohonen.som.kernel;

import kohonen.som.grid.GridPos;

public class BmuOnlyKernel implements KernelFunction {

	@Override
	public double getValue(GridPos bmu, int t, int tMax, GridPos pos) {
		if( bmu.equals(pos) )
			return 1;
		else
			return 0;
	}
}
