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

import io.nosqlbench.dynamo.common.grid.PointGrid;
import io.nosqlbench.dynamo.common.symbolic.RationalAngle;
import io.nosqlbench.dynamo.core.family.QuadraticFamily;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class RayTracerTest {

    private static List<Complex> collect(Iterator<Complex> ray) {
        List<Complex> points = new ArrayList<>();
        ray.forEachRemaining(points::add);
        return points;
    }

    private final QuadraticFamily family = new QuadraticFamily(new PointGrid(4000, 3000, QuadraticFamily.BOUNDS));

    @Test
    public void thirdRayLandsAtTheRootOfThePeriodTwoBulb() {
        Optional<Iterator<Complex>> ray = family.externalRay(RationalAngle.of(1, 3));
        assertThat(ray).isPresent();
        List<Complex> points = collect(ray.get());

        // continues through many rounds, not only the first
        assertThat(points.size()).isGreaterThan(2 * TracerOptions.DEFAULT_SHARPNESS);
        assertThat(points.get(0).abs()).isGreaterThan(100.0);
        Complex last = points.get(points.size() - 1);
        assertThat(last.subtract(new Complex(-0.75, 0.0)).abs()).isLessThan(0.1);
        assertThat(last.getImaginary()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    public void rayEndsOnAShrinkingStep() {
        List<Complex> points = collect(family.externalRay(RationalAngle.of(1, 7)).orElseThrow());
        assertThat(points.size()).isGreaterThan(TracerOptions.DEFAULT_SHARPNESS);
        int n = points.size();
        double lastSpacing = points.get(n - 1).subtract(points.get(n - 2)).abs();
        double spacingBefore = points.get(n - 2).subtract(points.get(n - 3)).abs();
        assertThat(lastSpacing).isLessThan(spacingBefore);
        assertThat(points.get(n - 1).abs()).isLessThan(2.0);
    }

    @Test
    public void rayIsSingleUse() {
        Iterator<Complex> ray = new RayTracer<>(family, TracerOptions.builder().depth(1).build())
            .trace(RationalAngle.of(0, 1))
            .orElseThrow();
        List<Complex> points = collect(ray);
        assertThat(points).hasSize(TracerOptions.DEFAULT_SHARPNESS);
        assertThat(ray.hasNext()).isFalse();
        assertThatThrownBy(ray::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    public void noRaysWithoutFiniteDegree() {
        QuadraticFamily noDegree = new QuadraticFamily() {
            @Override
            public double degreeReal() {
                return Double.NaN;
            }
        };
        assertThat(noDegree.externalRay(RationalAngle.of(1, 3))).isEmpty();
    }
}
