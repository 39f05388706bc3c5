package kohonen.utils;

import java.util.Random;

/**
 * Process-wide random source used by every component that is not handed an
 * explicit {@link Random}. Seed it before training for reproducible runs.
 */
public class RandomSource {

	private static final Random r = new Random();

	private RandomSource() {
	}

	public static Random get() {
		return r;
	}

	// reseeds the shared instance, so components holding it see the new sequence
	public static void setSeed(long seed) {
		r.setSeed(seed);
	}
}
