package io.nosqlbench.dynamo.core.trace;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.dynamo.common.math.Dual;
import io.nosqlbench.dynamo.core.family.QuadraticFamily;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
public class EquipotentialTracerTest {

    private final QuadraticFamily family = new QuadraticFamily();

    @Test
    public void pointsShareOneLevel() {
        Complex base = new Complex(3.0, 0.0);
        // 0 -> 3 -> 12, and 12^2 > 30 after two iterations
        List<Complex> curve = family.equipotential(base).orElseThrow();
        assertThat(curve).hasSize(1 + 200);
        assertThat(curve.get(0)).isEqualTo(base);
        for (Complex t : curve) {
            double level = t.multiply(t).add(t).abs();
            assertThat(level).isCloseTo(12.0, within(1e-4));
        }
    }

    @Test
    public void curveCloses() {
        List<Complex> curve = family.equipotential(new Complex(3.0, 0.0)).orElseThrow();
        Complex last = curve.get(curve.size() - 1);
        assertThat(last.subtract(curve.get(0)).abs()).isLessThan(1e-3);
        assertThat(curve).anySatisfy(t -> assertThat(t.getReal()).isNegative());
    }

    @Test
    public void failedStepsAreLeftOut() {
        // no finite values above the real axis, so Newton fails on every step that leads there
        QuadraticFamily lowerHalf = new QuadraticFamily() {
            @Override
            public Dual iterateD(Complex t, int steps) {
                if (t.getImaginary() > 0.0) {
                    return new Dual(Complex.NaN, Complex.NaN);
                }
                return super.iterateD(t, steps);
            }
        };
        List<Complex> curve = lowerHalf.equipotential(new Complex(3.0, 0.0)).orElseThrow();
        assertThat(curve.size()).isBetween(2, 200);
        for (int i = 1; i < curve.size(); i++) {
            assertThat(curve.get(i)).isNotEqualTo(curve.get(i - 1));
        }
        for (Complex t : curve) {
            assertThat(t.getImaginary()).isLessThanOrEqualTo(0.0);
            assertThat(t.multiply(t).add(t).abs()).isCloseTo(12.0, within(1e-4));
        }
    }

    @Test
    public void boundedBasePointHasNoCurve() {
        assertThat(family.equipotential(Complex.ZERO)).isEmpty();
    }
}
