package io.nosqlbench.dynamo.common.math;

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

import org.apache.commons.math3.complex.Complex;

/// Small helpers over [Complex] that the engine uses in its inner loops.
///
/// Squared norms and distances are preferred throughout, since every threshold in the
/// engine (escape radius, periodicity tolerance, Newton error) is compared in squared form.
public final class Complexes {

    /// One full turn, in radians.
    public static final double TAU = 2.0 * Math.PI;

    private Complexes() {
    }

    public static double normSqr(Complex z) {
        double re = z.getReal();
        double im = z.getImaginary();
        return re * re + im * im;
    }

    public static double distSqr(Complex a, Complex b) {
        double dr = a.getReal() - b.getReal();
        double di = a.getImaginary() - b.getImaginary();
        return dr * dr + di * di;
    }

    /// @return true only if both components are finite numbers
    public static boolean isFinite(Complex z) {
        return Double.isFinite(z.getReal()) && Double.isFinite(z.getImaginary());
    }

    /// Returns the point on the unit circle at the given angle, measured in turns.
    ///
    /// @param turns angle as a fraction of a full turn
    /// @return `exp(2 pi i turns)`
    public static Complex toCircle(double turns) {
        double theta = TAU * turns;
        return new Complex(Math.cos(theta), Math.sin(theta));
    }

    public static Complex polar(double radius, double theta) {
        return new Complex(radius * Math.cos(theta), radius * Math.sin(theta));
    }

    /// Integer power by repeated squaring. Negative exponents invert the result.
    public static Complex powInt(Complex z, int n) {
        if (n < 0) {
            return Complex.ONE.divide(powInt(z, -n));
        }
        Complex result = Complex.ONE;
        Complex base = z;
        int e = n;
        while (e > 0) {
            if ((e & 1) == 1) {
                result = result.multiply(base);
            }
            e >>= 1;
            if (e > 0) {
                base = base.multiply(base);
            }
        }
        return result;
    }

    public static Complex of(double re) {
        return new Complex(re, 0.0);
    }
}
