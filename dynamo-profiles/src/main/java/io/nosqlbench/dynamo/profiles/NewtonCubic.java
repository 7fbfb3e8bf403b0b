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

import com.google.auto.service.AutoService;
import io.nosqlbench.dynamo.common.grid.Bounds;
import io.nosqlbench.dynamo.common.grid.PointGrid;
import io.nosqlbench.dynamo.core.family.AbstractFractalFamily;
import io.nosqlbench.dynamo.core.family.FamilyName;
import io.nosqlbench.dynamo.core.family.FractalFamily;
import io.nosqlbench.dynamo.core.family.Gradient;
import io.nosqlbench.dynamo.core.family.Mapped;
import org.apache.commons.math3.complex.Complex;

import java.util.List;

/// Newton's method for the cubic `p(z) = z^3 + (c - 1) z - c = (z - 1)(z^2 + z + c)`.
///
/// The roots are the marked points, in the order `1`, `(-1 + sqrt(1 - 4c)) / 2`,
/// `(-1 - sqrt(1 - 4c)) / 2`. The free critical point `0` is iterated. Infinity is a
/// repelling fixed point, so there are no external rays.
@AutoService(FractalFamily.class)
@FamilyName("newton-cubic")
public class NewtonCubic extends AbstractFractalFamily<Complex> {

    public static final Bounds DEFAULT_BOUNDS = new Bounds(-2.5, 2.5, -2.0, 2.0);
    public static final double MARKED_POINT_TOLERANCE = 1e-10;

    public NewtonCubic() {
        this(PointGrid.withResX(800, DEFAULT_BOUNDS));
    }

    public NewtonCubic(PointGrid grid) {
        super(grid);
    }

    @Override
    public String name() {
        return "Newton cubic";
    }

    private static Complex derivative(Complex z, Complex c) {
        return z.multiply(z).multiply(3).add(c).subtract(1);
    }

    @Override
    public Complex map(Complex z, Complex c) {
        Complex z3 = z.multiply(z).multiply(z);
        return z3.multiply(2).add(c).divide(derivative(z, c));
    }

    @Override
    public Gradient gradient(Complex z, Complex c) {
        Complex z2 = z.multiply(z);
        Complex z3 = z2.multiply(z);
        Complex dp = derivative(z, c);
        Complex dp2 = dp.multiply(dp);
        Complex p = z3.add(c.subtract(1).multiply(z)).subtract(c);
        Complex value = z3.multiply(2).add(c).divide(dp);
        Complex dz = z.multiply(6).multiply(p).divide(dp2);
        Complex dc = z2.multiply(3).subtract(1).subtract(z3.multiply(2)).divide(dp2);
        return new Gradient(value, dz, dc);
    }

    @Override
    public Complex paramMap(Complex t) {
        return t;
    }

    @Override
    public Mapped<Complex> paramMapD(Complex t) {
        return new Mapped<>(t, Complex.ONE);
    }

    @Override
    public Complex startPoint(Complex t, Complex c) {
        return Complex.ZERO;
    }

    @Override
    public Gradient startPointD(Complex t, Complex c) {
        return new Gradient(Complex.ZERO, Complex.ZERO, Complex.ZERO);
    }

    @Override
    public List<Complex> markedPoints(Complex c) {
        Complex root = Complex.ONE.subtract(c.multiply(4)).sqrt();
        return List.of(
            Complex.ONE,
            root.subtract(1).multiply(0.5),
            root.add(1).negate().multiply(0.5));
    }

    @Override
    public double markedPointTolerance() {
        return MARKED_POINT_TOLERANCE;
    }

    @Override
    public double degreeReal() {
        return Double.NaN;
    }
}
