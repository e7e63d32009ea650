package org.asymptote.compiler.analysis.complexity;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GrowthClassTest {

    @Test
    void labelsTheCommonClasses() {
        assertThat(GrowthClass.CONSTANT.label()).isEqualTo("1");
        assertThat(GrowthClass.LOGARITHMIC.label()).isEqualTo("log n");
        assertThat(GrowthClass.LINEAR.label()).isEqualTo("n");
        assertThat(GrowthClass.LINEARITHMIC.label()).isEqualTo("n log n");
        assertThat(GrowthClass.QUADRATIC.label()).isEqualTo("n^2");
        assertThat(GrowthClass.polyLog(2, 2).label()).isEqualTo("n^2 log^2 n");
        assertThat(GrowthClass.polynomial(Math.log(3) / Math.log(2)).label()).isEqualTo("n^1.585");
        assertThat(GrowthClass.exponential(2).label()).isEqualTo("2^n");
        assertThat(GrowthClass.exponential(2).times(GrowthClass.LINEAR).label()).isEqualTo("n · 2^n");
        assertThat(GrowthClass.polynomial(2e10).label()).isEqualTo("n^20000000000");
    }

    @Test
    void ordersByBaseThenDegreeThenLogPower() {
        List<GrowthClass> classes = new ArrayList<>(List.of(
                GrowthClass.exponential(2), GrowthClass.QUADRATIC, GrowthClass.CONSTANT,
                GrowthClass.LINEARITHMIC, GrowthClass.LOGARITHMIC, GrowthClass.LINEAR));
        Collections.sort(classes);

        assertThat(classes).containsExactly(GrowthClass.CONSTANT, GrowthClass.LOGARITHMIC, GrowthClass.LINEAR,
                GrowthClass.LINEARITHMIC, GrowthClass.QUADRATIC, GrowthClass.exponential(2));
        assertThat(GrowthClass.polynomial(1.5)).isGreaterThan(GrowthClass.polyLog(1, 5));
    }

    @Test
    void computedExponentsCompareEqualToExactOnes() {
        GrowthClass computed = GrowthClass.polynomial(Math.log(4) / Math.log(2));

        assertThat(computed).isEqualTo(GrowthClass.QUADRATIC);
        assertThat(computed.compareTo(GrowthClass.QUADRATIC)).isZero();
    }

    @Test
    void multipliesFactorWise() {
        assertThat(GrowthClass.LINEAR.times(GrowthClass.LOGARITHMIC)).isEqualTo(GrowthClass.LINEARITHMIC);
        assertThat(GrowthClass.LINEAR.times(GrowthClass.LINEAR)).isEqualTo(GrowthClass.QUADRATIC);
        assertThat(GrowthClass.CONSTANT.times(GrowthClass.LINEARITHMIC)).isEqualTo(GrowthClass.LINEARITHMIC);
    }

    @Test
    void powRejectsFractionalLogPowers() {
        assertThat(GrowthClass.LINEAR.pow(0.5)).isEqualTo(GrowthClass.polynomial(0.5));
        assertThat(GrowthClass.LINEARITHMIC.pow(2)).isEqualTo(GrowthClass.polyLog(2, 2));
        assertThat(GrowthClass.LINEARITHMIC.pow(0.5)).isNull();
    }

    @Test
    void powAndTimesRejectNonFiniteResults() {
        assertThat(GrowthClass.CONSTANT.pow(Double.POSITIVE_INFINITY)).isNull();
        assertThat(GrowthClass.LINEAR.pow(Double.NaN)).isNull();
        assertThat(GrowthClass.exponential(2).pow(1e6)).isNull();
        assertThat(GrowthClass.polynomial(1e308).times(GrowthClass.polynomial(1e308))).isNull();
    }

    @Test
    void dividesPurePolynomialsOnly() {
        assertThat(GrowthClass.QUADRATIC.dividedBy(GrowthClass.LINEAR)).isEqualTo(GrowthClass.LINEAR);
        assertThat(GrowthClass.LINEAR.dividedBy(GrowthClass.QUADRATIC)).isNull();
        assertThat(GrowthClass.LINEARITHMIC.dividedBy(GrowthClass.LINEAR)).isNull();
    }

    @Test
    void logarithmOfEachFamily() {
        assertThat(GrowthClass.exponential(3).logarithm()).isEqualTo(GrowthClass.LINEAR);
        assertThat(GrowthClass.QUADRATIC.logarithm()).isEqualTo(GrowthClass.LOGARITHMIC);
        assertThat(GrowthClass.CONSTANT.logarithm()).isEqualTo(GrowthClass.CONSTANT);
        assertThat(GrowthClass.LOGARITHMIC.logarithm()).isNull();
    }

    @Test
    void rejectsInvalidComponents() {
        assertThatThrownBy(() -> new GrowthClass(0.5, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GrowthClass(1, -1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GrowthClass(1, 0, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
