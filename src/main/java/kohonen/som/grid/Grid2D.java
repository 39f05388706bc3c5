package kohonen.som.grid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Rectangular grid of neurons with dense coordinates [0,xSize) x [0,ySize).
 */
public class Grid2D {

	private final Neuron[][] neurons;
	private final int xSize, ySize;

	public Grid2D(int xSize, int ySize) {
		if( xSize < 1 || ySize < 1 )
			throw new IllegalArgumentException("Grid must be at least 1x1: " + xSize + "x" + ySize);
		this.xSize = xSize;
		this.ySize = ySize;
		this.neurons = new Neuron[xSize][ySize];
		for( int i = 0; i < xSize; i++ )
			for( int j = 0; j < ySize; j++ )
				neurons[i][j] = new Neuron(i, j);
	}

	public int getXSize() {
		return xSize;
	}

	public int getYSize() {
		return ySize;
	}

	public int size() {
		return xSize * ySize;
	}

	public Neuron getNeuron(int x, int y) {
		return neurons[x][y];
	}

	public Neuron getNeuron(GridPos p) {
		return neurons[p.getX()][p.getY()];
	}

	public boolean contains(GridPos p) {
		return p.getX() >= 0 && p.getX() < xSize && p.getY() >= 0 && p.getY() < ySize;
	}

	// row-major, x outer
	public List<Neuron> getNeurons() {
		List<Neuron> l = new ArrayList<>(size());
		for( int i = 0; i < xSize; i++ )
			for( int j = 0; j < ySize; j++ )
				l.add(neurons[i][j]);
		return l;
	}

	// in output space
	public double dist(GridPos aPos, GridPos bPos) {
		return aPos.dist(bPos);
	}

	// width of the weight vectors, 0 if not initialized
	public int getWeightWidth() {
		return neurons[0][0].getWeights().length;
	}

	// rook
	public Collection<GridPos> getNeighbours(GridPos pos) {
		List<GridPos> l = new ArrayList<>(4);
		int x = pos.getX();
		int y = pos.getY();

		for( GridPos p : new GridPos[] { new GridPos(x - 1, y), new GridPos(x, y + 1), new GridPos(x + 1, y), new GridPos(x, y - 1) } )
			if( contains(p) )
				l.add(p);
		return l;
	}
}
