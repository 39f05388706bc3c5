package kohonen.som.grid;

import java.util.Arrays;

/**
 * A grid cell: fixed position, weight vector and the scratch distance of the last
 * BMU search. The distance is only meaningful right after a search.
 */
public class Neuron {

	private final GridPos pos;
	private double[] weights = new double[0];
	private double distance;

	public Neuron(GridPos pos) {
		this.pos = pos;
	}

	public Neuron(int x, int y) {
		this(new GridPos(x, y));
	}

	public GridPos getPos() {
		return pos;
	}

	public int getX() {
		return pos.getX();
	}

	public int getY() {
		return pos.getY();
	}

	public double[] getWeights() {
		return weights;
	}

	public void setWeights(double[] weights) {
		this.weights = weights;
	}

	public double getDistance() {
		return distance;
	}

	public void setDistance(double distance) {
		this.distance = distance;
	}

	public boolean isInitialized() {
		return weights.length > 0;
	}

	@Override
	public String toString() {
		return "Neuron" + pos + Arrays.toString(weights);
	}
}
