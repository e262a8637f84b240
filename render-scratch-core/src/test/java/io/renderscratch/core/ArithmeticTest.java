package io.renderscratch.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class ArithmeticTest {

    @Test
    void addsIntegralNumbers() {
        ScratchValue sum = Arithmetic.add(ScratchValue.of(2), ScratchValue.of(3));
        assertThat(sum).isEqualTo(ScratchValue.of(5));
        assertThat(((ScratchValue.Numeric) sum).isIntegral()).isTrue();
    }

    @Test
    void promotesMixedIntegralAndDecimalToDouble() {
        ScratchValue sum = Arithmetic.add(ScratchValue.of(2), ScratchValue.of(0.5));
        assertThat(sum).isEqualTo(ScratchValue.of(2.5));
        assertThat(((ScratchValue.Numeric) sum).isIntegral()).isFalse();
    }

    @Test
    void appliesEveryOperatorToNumbers() {
        assertThat(Arithmetic.apply(ScratchValue.of(7), ScratchValue.of(2), Operator.SUBTRACT)).isEqualTo(ScratchValue.of(5));
        assertThat(Arithmetic.apply(ScratchValue.of(7), ScratchValue.of(2), Operator.MULTIPLY)).isEqualTo(ScratchValue.of(14));
        assertThat(Arithmetic.apply(ScratchValue.of(7), ScratchValue.of(2), Operator.DIVIDE)).isEqualTo(ScratchValue.of(3));
        assertThat(Arithmetic.apply(ScratchValue.of(7.0), ScratchValue.of(2), Operator.DIVIDE)).isEqualTo(ScratchValue.of(3.5));
    }

    @Test
    void concatenatesText() {
        assertThat(Arithmetic.add(ScratchValue.of("foo"), ScratchValue.of("bar"))).isEqualTo(ScratchValue.of("foobar"));
    }

    @Test
    void rejectsNonAdditionOperatorOnText() {
        assertThatThrownBy(() -> Arithmetic.apply(ScratchValue.of("a"), ScratchValue.of("b"), Operator.SUBTRACT))
                .isInstanceOf(ScratchException.Arithmetic.class)
                .hasMessageContaining("'-'");
    }

    @Test
    void rejectsNumericWithText() {
        assertThatThrownBy(() -> Arithmetic.add(ScratchValue.of(5), ScratchValue.of("text")))
                .isInstanceOf(ScratchException.Arithmetic.class)
                .hasMessageContaining("numeric")
                .hasMessageContaining("text");
    }

    @Test
    void rejectsContainers() {
        ScratchValue seq = ScratchValue.sequenceOf(1, 2);
        assertThatThrownBy(() -> Arithmetic.add(seq, ScratchValue.of(1)))
                .isInstanceOf(ScratchException.Arithmetic.class);
        assertThatThrownBy(() -> Arithmetic.add(ScratchValue.of(1), ScratchValue.Mapping.empty()))
                .isInstanceOf(ScratchException.Arithmetic.class);
    }

    @Test
    void failsOnIntegerOverflow() {
        assertThatThrownBy(() -> Arithmetic.add(ScratchValue.of(Long.MAX_VALUE), ScratchValue.of(1)))
                .isInstanceOf(ScratchException.Arithmetic.class)
                .hasMessageContaining("overflow")
                .hasCauseInstanceOf(ArithmeticException.class);
        assertThatThrownBy(() -> Arithmetic.apply(ScratchValue.of(Long.MIN_VALUE), ScratchValue.of(-1), Operator.DIVIDE))
                .isInstanceOf(ScratchException.Arithmetic.class);
    }

    @Test
    void failsOnIntegralDivisionByZero() {
        ScratchException.Arithmetic e = (ScratchException.Arithmetic) catchThrowable(
                () -> Arithmetic.apply(ScratchValue.of(1), ScratchValue.of(0), Operator.DIVIDE));
        assertThat(e).hasMessageContaining("divide");
        assertThat(e.operator()).isEqualTo(Operator.DIVIDE);
    }

    @Test
    void decimalDivisionByZeroIsInfinite() {
        ScratchValue q = Arithmetic.apply(ScratchValue.of(1.0), ScratchValue.of(0), Operator.DIVIDE);
        assertThat(((ScratchValue.Numeric) q).doubleValue()).isInfinite();
    }

    @Test
    void resolvesOperatorSymbols() {
        assertThat(Operator.fromSymbol('+')).isEqualTo(Operator.ADD);
        assertThat(Operator.fromSymbol('/')).isEqualTo(Operator.DIVIDE);
        assertThatThrownBy(() -> Operator.fromSymbol('%')).isInstanceOf(IllegalArgumentException.class);
    }
}
