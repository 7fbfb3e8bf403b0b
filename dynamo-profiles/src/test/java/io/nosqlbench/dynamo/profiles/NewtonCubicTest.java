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
import io.nosqlbench.dynamo.core.family.Gradient;
import io.nosqlbench.dynamo.core.family.JuliaSet;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
public class NewtonCubicTest {

    private final NewtonCubic newton = new NewtonCubic();

    private static PointInfo.MarkedPoint marked(PointInfo info) {
        assertThat(info).isInstanceOf(PointInfo.MarkedPoint.class);
        return (PointInfo.MarkedPoint) info;
    }

    @Test
    public void criticalPointIsARootAtZero() {
        // c = 0 gives roots 1, 0, -1 and the critical point 0 is the middle root
        PointInfo.MarkedPoint point = marked(newton.classifyPoint(Complex.ZERO));
        assertThat(point.classId()).isEqualTo(1);
        assertThat(point.numPointClasses()).isEqualTo(3);
    }

    @Test
    public void juliaBasinsFollowTheRoots() {
        JuliaSet<Complex> julia = new JuliaSet<>(newton, Complex.ZERO);
        assertThat(marked(julia.classifyPoint(new Complex(0.9, 0.0))).classId()).isEqualTo(0);
        assertThat(marked(julia.classifyPoint(new Complex(-0.9, 0.0))).classId()).isEqualTo(2);
    }

    @Test
    public void gradientMatchesDifferenceQuotients() {
        Complex z = new Complex(0.7, 0.3);
        Complex c = new Complex(-0.2, 0.4);
        Gradient gradient = newton.gradient(z, c);
        double h = 1e-6;
        Complex dz = newton.map(z.add(h), c).subtract(newton.map(z.subtract(h), c)).divide(2 * h);
        Complex dc = newton.map(z, c.add(h)).subtract(newton.map(z, c.subtract(h))).divide(2 * h);
        assertThat(gradient.value()).isEqualTo(newton.map(z, c));
        assertThat(gradient.dz().subtract(dz).abs()).isLessThan(1e-6);
        assertThat(gradient.dc().subtract(dc).abs()).isLessThan(1e-6);
    }

    @Test
    public void hasNoExternalRaysOrEquipotentials() {
        assertThat(newton.hasFiniteDegree()).isFalse();
        assertThat(newton.externalRay(RationalAngle.of(1, 3))).isEmpty();
        assertThat(newton.equipotential(new Complex(1.0, 1.0))).isEmpty();
    }
}
