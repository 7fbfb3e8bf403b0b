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

import io.nosqlbench.dynamo.common.grid.Bounds;
import io.nosqlbench.dynamo.common.grid.PointGrid;
import io.nosqlbench.dynamo.common.math.Dual;
import io.nosqlbench.dynamo.core.family.CoveringMap;
import io.nosqlbench.dynamo.core.family.FractalFamily;
import org.apache.commons.math3.complex.Complex;

/// Covering maps of the Mandelbrot parameter plane.
///
/// | cover | coordinate `t` | `c(t)` |
/// |---|---|---|
/// | marked fixed point | fixed point `z = t + 1/2` | `1/4 - t^2` |
/// | marked 2-cycle | cycle point `z = t` | `-t^2 - t - 1` |
/// | Misiurewicz (2, 1) | uniformizing coordinate | `-2 (t^2 + 1) / (t^2 - 1)^2` |
public final class MandelbrotCovers {

    public static final Bounds COVER_BOUNDS = new Bounds(-2.0, 2.0, -2.0, 2.0);

    private static final Complex QUARTER = new Complex(0.25, 0.0);

    private MandelbrotCovers() {
    }

    public static CoveringMap markedFixedPoint(FractalFamily<Complex> mandelbrot) {
        return new CoveringMap(mandelbrot, "marked fixed point", t -> {
            Dual s = Dual.variable(t);
            return Dual.constant(QUARTER).minus(s.times(s));
        }, defaultGrid(mandelbrot));
    }

    public static CoveringMap markedTwoCycle(FractalFamily<Complex> mandelbrot) {
        return new CoveringMap(mandelbrot, "marked 2-cycle", t -> {
            Dual s = Dual.variable(t);
            return s.times(s).plus(s).plus(Complex.ONE).times(Complex.ONE.negate());
        }, defaultGrid(mandelbrot));
    }

    public static CoveringMap misiurewicz21(FractalFamily<Complex> mandelbrot) {
        return new CoveringMap(mandelbrot, "Misiurewicz (2, 1)", t -> {
            Dual s = Dual.variable(t);
            Dual s2 = s.times(s);
            Dual numerator = s2.plus(Complex.ONE).times(new Complex(-2.0, 0.0));
            Dual denominator = s2.minus(Complex.ONE).pow(2);
            return numerator.divide(denominator);
        }, defaultGrid(mandelbrot));
    }

    private static PointGrid defaultGrid(FractalFamily<Complex> family) {
        return new PointGrid(family.pointGrid().resX(), family.pointGrid().resX(), COVER_BOUNDS);
    }
}
