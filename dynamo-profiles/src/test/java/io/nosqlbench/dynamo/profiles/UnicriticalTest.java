package io.nosqlbench.dynamo.profiles;

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

import io.nosqlbench.dynamo.common.point.PointInfo;
import io.nosqlbench.dynamo.common.symbolic.RationalAngle;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class UnicriticalTest {

    @Test
    public void cubicDefaults() {
        Unicritical cubic = new Unicritical();
        assertThat(cubic.degree()).isEqualTo(Unicritical.DEFAULT_DEGREE);
        assertThat(cubic.metaParams().localParam()).isEqualTo(3);
        assertThat(cubic.map(new Complex(2.0, 0.0), Complex.ONE)).isEqualTo(new Complex(9.0, 0.0));
    }

    @Test
    public void classifiesInteriorAndExterior() {
        Unicritical cubic = new Unicritical(3);
        PointInfo interior = cubic.classifyPoint(Complex.ZERO);
        assertThat(interior).isInstanceOf(PointInfo.Periodic.class);
        assertThat(((PointInfo.Periodic) interior).info().period()).isEqualTo(1);
        assertThat(cubic.classifyPoint(new Complex(1.0, 0.0))).isInstanceOf(PointInfo.Escaping.class);
    }

    @Test
    public void raysExistForEveryDegree() {
        assertThat(new Unicritical(4).externalRay(RationalAngle.of(1, 4))).isPresent();
    }

    @Test
    public void rejectsDegreeBelowTwo() {
        assertThatThrownBy(() -> new Unicritical(1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("degree");
    }
}
