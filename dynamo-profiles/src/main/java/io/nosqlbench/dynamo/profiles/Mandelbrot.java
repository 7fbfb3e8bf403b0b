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
import io.nosqlbench.dynamo.common.math.Dual;
import io.nosqlbench.dynamo.common.point.KnownPotentialInfo;
import io.nosqlbench.dynamo.common.point.PointInfo;
import io.nosqlbench.dynamo.core.family.AbstractFractalFamily;
import io.nosqlbench.dynamo.core.family.FamilyName;
import io.nosqlbench.dynamo.core.family.FractalFamily;
import io.nosqlbench.dynamo.core.family.Gradient;
import io.nosqlbench.dynamo.core.family.Mapped;
import org.apache.commons.math3.complex.Complex;

import java.util.List;
import java.util.Optional;

/// The quadratic family `z -> z^2 + c`, explored in the parameter plane from the critical
/// point `0`.
///
/// Parameters in the main cardioid and in the period-2 bulb are answered in closed form
/// through [#earlyBailout(Complex, Complex)], since their attracting cycle and multiplier
/// are known exactly.
@AutoService(FractalFamily.class)
@FamilyName("mandelbrot")
public class Mandelbrot extends AbstractFractalFamily<Complex> {

    public static final Bounds DEFAULT_BOUNDS = new Bounds(-2.2, 1.0, -1.2, 1.2);
    public static final int DEFAULT_RES_X = 800;

    private volatile boolean earlyBailoutEnabled = true;

    public Mandelbrot() {
        this(PointGrid.withResX(DEFAULT_RES_X, DEFAULT_BOUNDS));
    }

    public Mandelbrot(PointGrid grid) {
        super(grid);
    }

    @Override
    public String name() {
        return "Mandelbrot";
    }

    /// Turns the closed-form cardioid and bulb shortcut on or off. With it off, every
    /// parameter is iterated.
    public Mandelbrot withEarlyBailout(boolean enabled) {
        this.earlyBailoutEnabled = enabled;
        return this;
    }

    @Override
    public Complex map(Complex z, Complex c) {
        return z.multiply(z).add(c);
    }

    @Override
    public Dual mapAndMultiplier(Complex z, Complex c) {
        return new Dual(z.multiply(z).add(c), z.multiply(2));
    }

    @Override
    public Gradient gradient(Complex z, Complex c) {
        return new Gradient(z.multiply(z).add(c), z.multiply(2), Complex.ONE);
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
    public Optional<PointInfo> earlyBailout(Complex z0, Complex c) {
        if (!earlyBailoutEnabled) {
            return Optional.empty();
        }
        // main cardioid
        Complex fourC = c.multiply(4);
        double y2 = fourC.getImaginary() * fourC.getImaginary();
        double temp = fourC.getReal() - 1.0;
        double muNorm2 = temp * temp + y2;
        double a = muNorm2 * (muNorm2 * 0.25 + temp);
        if (a < y2) {
            Complex multiplier = Complex.ONE.subtract(Complex.ONE.subtract(fourC).sqrt());
            Complex fixedPoint = multiplier.multiply(0.5);
            double potential = interiorPotential(c, fixedPoint, multiplier, 2.0);
            return Optional.of(new PointInfo.PeriodicKnownPotential(
                new KnownPotentialInfo(1, multiplier, potential)));
        }

        // period-2 bulb
        Complex mu2 = fourC.add(4);
        double multNorm2 = Complexes.normSqr(mu2);
        if (multNorm2 < 1.0) {
            Complex cyclePoint = Complexes.of(-0.5).subtract(fourC.negate().subtract(3).sqrt().multiply(0.5));
            double potential = interiorPotential(c, cyclePoint, mu2, 4.0);
            return Optional.of(new PointInfo.PeriodicKnownPotential(
                new KnownPotentialInfo(2, mu2, potential)));
        }
        return Optional.empty();
    }

    private double interiorPotential(Complex c, Complex cyclePoint, Complex multiplier, double scale) {
        double initDist = Complexes.distSqr(c, cyclePoint);
        double potential = -scale * Math.log(initDist / periodicityTolerance()) / Math.log(Complexes.normSqr(multiplier));
        return Double.isFinite(potential) ? potential : 0.0;
    }

    /// The Julia child carries the two fixed points as marked points.
    @Override
    public List<Complex> markedPointsChild(Complex c) {
        Complex root = Complex.ONE.subtract(c.multiply(4)).sqrt();
        return List.of(
            Complex.ONE.add(root).multiply(0.5),
            Complex.ONE.subtract(root).multiply(0.5));
    }
}
