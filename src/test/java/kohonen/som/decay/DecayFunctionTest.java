package kohonen.som.decay;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class DecayFunctionTest {

	@Test
	void constant_defaults_to_no_restraint() {
		assertThat(new ConstantDecay().getValue(0, 10)).isEqualTo(1.0);
		assertThat(new ConstantDecay().getValue(9, 10)).isEqualTo(1.0);
		assertThat(new ConstantDecay(0.3).getValue(5, 10)).isEqualTo(0.3);
	}

	@Test
	void simple() {
		DecayFunction df = new SimpleDecay(1, 1);
		assertThat(df.getValue(0, 100)).isEqualTo(1.0);
		assertThat(df.getValue(1, 100)).isEqualTo(0.5);
		assertThat(df.getValue(3, 100)).isEqualTo(0.25);
	}

	@Test
	void exponential_over_run_length() {
		DecayFunction df = new ExponentialDecay(2);
		assertThat(df.getValue(0, 10)).isEqualTo(2.0);
		assertThat(df.getValue(5, 10)).isCloseTo(2 * Math.exp(-0.5), within(1e-12));
	}

	@Test
	void exponential_with_fixed_denominator() {
		DecayFunction df = new ExponentialDecay(2, 5);
		assertThat(df.getValue(5, 100)).isCloseTo(2 * Math.exp(-1), within(1e-12));
		assertThat(df.getValue(5, 1000)).isCloseTo(2 * Math.exp(-1), within(1e-12));
		assertThatThrownBy(() -> new ExponentialDecay(1, 0)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void linear_and_power() {
		assertThat(new LinearDecay(1, 0).getValue(5, 10)).isCloseTo(0.5, within(1e-12));
		assertThat(new LinearDecay(4, 2).getValue(0, 10)).isEqualTo(4.0);
		assertThat(new PowerDecay(1, 0.01).getValue(5, 10)).isCloseTo(0.1, within(1e-12));
	}
}
