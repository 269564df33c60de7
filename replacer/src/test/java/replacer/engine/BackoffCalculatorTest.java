package replacer.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BackoffCalculator")
class BackoffCalculatorTest {

    @Test
    @DisplayName("should double the delay on each attempt")
    void shouldDoubleDelay() {
        BackoffCalculator calc = new BackoffCalculator(1000, 30_000, 0.1, () -> 0.0);

        assertThat(calc.calculate(1)).isEqualTo(1000);
        assertThat(calc.calculate(2)).isEqualTo(2000);
        assertThat(calc.calculate(3)).isEqualTo(4000);
    }

    @Test
    @DisplayName("should add jitter proportional to the delay")
    void shouldAddJitter() {
        BackoffCalculator calc = new BackoffCalculator(1000, 30_000, 0.1, () -> 0.5);

        assertThat(calc.calculate(2)).isEqualTo(2100);
    }

    @Test
    @DisplayName("should cap at the maximum delay")
    void shouldCapAtMaximum() {
        BackoffCalculator calc = new BackoffCalculator(1000, 5000, 1.0, () -> 0.99);

        assertThat(calc.calculate(10)).isEqualTo(5000);
        assertThat(calc.calculate(100)).isEqualTo(5000);
    }

    @Test
    @DisplayName("should stay within bounds with random jitter")
    void shouldStayWithinBounds() {
        BackoffCalculator calc = new BackoffCalculator(100, 10_000, 0.2);

        for (int i = 0; i < 50; i++) {
            assertThat(calc.calculate(3)).isBetween(400L, 480L);
        }
    }

    @Test
    @DisplayName("should validate parameters")
    void shouldValidateParameters() {
        assertThatThrownBy(() -> new BackoffCalculator(1000, 500, 0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(1000, 5000, 1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(1000, 5000, 0.1).calculate(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
