package kohonen.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;
import org.junit.jupiter.api.Test;

class DataSetTest {

	private static DataSet range(int n) {
		DataSet ds = new DataSet();
		for( int i = 0; i < n; i++ )
			ds.addRaw(i);
		return ds;
	}

	private static List<Double> firstCoordinates(DataSet ds) {
		List<Double> l = new ArrayList<>();
		for( double[] d : ds.getVectors() )
			l.add(d[0]);
		return l;
	}

	@Test
	void add_rejects_vectors_of_other_width() {
		DataSet ds = new DataSet();
		ds.addRaw(1, 2);
		assertThatThrownBy(() -> ds.addRaw(1, 2, 3)).isInstanceOf(DimensionMismatchException.class);
		assertThat(ds.size()).isEqualTo(1);
		assertThat(ds.width()).isEqualTo(2);
	}

	@Test
	void width_of_empty_set_fails() {
		assertThatThrownBy(() -> new DataSet().width()).isInstanceOf(NoDataException.class);
	}

	@Test
	void downsample_keeps_middle_of_each_segment() {
		DataSet ds = range(9);
		ds.downsample(3);
		assertThat(firstCoordinates(ds)).containsExactly(1.0, 4.0, 7.0);
	}

	@Test
	void downsample_with_uneven_segments() {
		// step 2.5: segments (0,2),(2,5),(5,7),(7,10)
		DataSet ds = range(10);
		ds.downsample(4);
		assertThat(firstCoordinates(ds)).containsExactly(1.0, 3.0, 6.0, 8.0);
	}

	@Test
	void downsample_is_noop_for_small_sets() {
		DataSet ds = range(3);
		ds.downsample(3);
		assertThat(firstCoordinates(ds)).containsExactly(0.0, 1.0, 2.0);
		ds.downsample(10);
		assertThat(ds.size()).isEqualTo(3);
	}

	@Test
	void sort_is_lexicographic_and_stable() {
		double[] a = { 1, 2 };
		double[] b = { 0, 5 };
		double[] c = { 1, 1 };
		double[] d = { 1, 1 };
		DataSet ds = new DataSet();
		ds.add(a);
		ds.add(d);
		ds.add(b);
		ds.add(c);

		ds.sortLexicographic();
		assertThat(ds.getVectors()).containsExactly(b, d, c, a);
	}

	@Test
	void copy_is_independent() {
		DataSet ds = range(3);
		DataSet cp = ds.copy();
		cp.get(0)[0] = 42;
		cp.addRaw(7);

		assertThat(ds.get(0)[0]).isEqualTo(0.0);
		assertThat(ds.size()).isEqualTo(3);
		assertThat(cp.size()).isEqualTo(4);
	}

	@Test
	void shuffle_permutes_in_place() {
		DataSet ds = range(50);
		ds.shuffle(new Random(7));

		assertThat(ds.size()).isEqualTo(50);
		assertThat(firstCoordinates(ds)).containsExactlyInAnyOrderElementsOf(firstCoordinates(range(50)));
		assertThat(firstCoordinates(ds)).isNotEqualTo(firstCoordinates(range(50)));
	}
}
