package io.nosqlbench.dynamo.common.grid;

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
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
public class PointGridTest {

    private final PointGrid grid = new PointGrid(400, 200, new Bounds(-2.0, 2.0, -1.0, 1.0));

    @Test
    public void topLeftPixelIsMinXMaxY() {
        Complex corner = grid.mapPixel(0, 0);
        assertThat(corner.getReal()).isEqualTo(-2.0);
        assertThat(corner.getImaginary()).isEqualTo(1.0);
        assertThat(grid.pixelWidth()).isCloseTo(0.01, within(1e-15));
    }

    @Test
    public void locateInvertsMapPixel() {
        Complex z = grid.mapPixel(123, 45);
        int[] pixel = grid.locatePoint(z.add(new Complex(0.001, -0.001))).orElseThrow();
        assertThat(pixel).containsExactly(123, 45);
        assertThat(grid.locatePoint(new Complex(5.0, 0.0))).isEmpty();
    }

    @Test
    public void squarePixelsFromWidth() {
        PointGrid inferred = PointGrid.withResX(320, new Bounds(-2.2, 1.0, -1.2, 1.2));
        assertThat(inferred.resY()).isEqualTo(240);
    }

    @Test
    public void boundsAreaAndNaN() {
        Bounds bounds = grid.bounds();
        assertThat(bounds.area()).isEqualTo(8.0);
        assertThat(bounds.isNaN()).isFalse();
        assertThat(new Bounds(Double.NaN, 1.0, 0.0, 1.0).isNaN()).isTrue();
        assertThat(bounds.center()).isEqualTo(Complex.ZERO);
    }

    @Test
    public void rejectsEmptyResolution() {
        assertThatThrownBy(() -> new PointGrid(0, 10, grid.bounds()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void iterPlaneIsRowMajor() {
        IterPlane plane = new IterPlane(new PointGrid(3, 2, grid.bounds()));
        assertThat(plane.get(2, 1)).isEqualTo(PointInfo.bounded());
        plane.set(2, 1, new PointInfo.Escaping(3.5));
        assertThat(plane.snapshot()[5]).isEqualTo(new PointInfo.Escaping(3.5));
        assertThatThrownBy(() -> plane.get(3, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        plane.fill(new PointInfo.Wandering());
        assertThat(plane.snapshot()).containsOnly(new PointInfo.Wandering());
    }
}
