package kohonen.som.select;

/**
 * Thrown by a {@link Selector} that has nothing left to select. Ends a training run early.
 */
public class NoDataLeftException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public NoDataLeftException() {
		super("No data left");
	}
}
