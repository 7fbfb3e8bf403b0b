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
import io.nosqlbench.dynamo.common.math.Complexes;
import io.nosqlbench.dynamo.common.params.ParamList;
import io.nosqlbench.dynamo.core.family.AbstractFractalFamily;
import io.nosqlbench.dynamo.core.family.FamilyName;
import io.nosqlbench.dynamo.core.family.FractalFamily;
import io.nosqlbench.dynamo.core.family.Gradient;
import io.nosqlbench.dynamo.core.family.Mapped;
import org.apache.commons.math3.complex.Complex;

/// Unicritical polynomials `z -> z^d + c` with a single finite critical point at `0`.
@AutoService(FractalFamily.class)
@FamilyName("unicritical")
public class Unicritical extends AbstractFractalFamily<Complex> {

    public static final int DEFAULT_DEGREE = 3;
    public static final Bounds DEFAULT_BOUNDS = new Bounds(-1.6, 1.6, -1.6, 1.6);

    private final int degree;

    public Unicritical() {
        this(DEFAULT_DEGREE);
    }

    public Unicritical(int degree) {
        this(degree, PointGrid.withResX(600, DEFAULT_BOUNDS));
    }

    public Unicritical(int degree, PointGrid grid) {
        super(grid);
        if (degree < 2) {
            throw new IllegalArgumentException("degree must be at least 2, got: " + degree);
        }
        this.degree = degree;
    }

    @Override
    public String name() {
        return "Unicritical degree " + degree;
    }

    @Override
    public Complex map(Complex z, Complex c) {
        return Complexes.powInt(z, degree).add(c);
    }

    @Override
    public Gradient gradient(Complex z, Complex c) {
        Complex lower = Complexes.powInt(z, degree - 1);
        return new Gradient(lower.multiply(z).add(c), lower.multiply(degree), Complex.ONE);
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
    public double degreeReal() {
        return degree;
    }

    @Override
    public ParamList<?> metaParams() {
        return ParamList.of(degree);
    }
}
