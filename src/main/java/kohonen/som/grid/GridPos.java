package kohonen.som.grid;

public final class GridPos implements Comparable<GridPos> {

	private final int x, y;

	public GridPos(int x, int y) {
		this.x = x;
		this.y = y;
	}

	public int getX() {
		return x;
	}

	public int getY() {
		return y;
	}

	// euclidean, in output space
	public double dist(GridPos o) {
		double dx = x - o.x;
		double dy = y - o.y;
		return Math.sqrt(dx * dx + dy * dy);
	}

	@Override
	public int hashCode() {
		return 31 * x + y;
	}

	@Override
	public boolean equals(Object obj) {
		if( this == obj )
			return true;
		if( obj == null )
			return false;
		if( getClass() != obj.getClass() )
			return false;

		GridPos other = (GridPos) obj;
		return x == other.x && y == other.y;
	}

	@Override
	public String toString() {
		return "[" + x + ", " + y + "]";
	}

	@Override
	public int compareTo(GridPos o) {
		if( x != o.x )
			return Integer.compare(x, o.x);
		return Integer.compare(y, o.y);
	}
}
