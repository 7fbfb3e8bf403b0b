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

/// A complex value paired with its derivative along some parametrization.
///
/// This is the single forward-mode differentiation primitive of the project. The point
/// locator carries `(f^n(t), d f^n / dt)` with it, the orbit engine accumulates cycle
/// multipliers with it, and covering maps compose reparametrizations through it.
///
/// Arithmetic follows the usual rules:
/// - `(a, a') * (b, b') = (ab, a'b + ab')`
/// - `(a, a') / (b, b') = (a/b, (a'b - ab') / b^2)`
///
/// @param value the value
/// @param deriv the derivative of the value
public record Dual(Complex value, Complex deriv) {

    public static Dual constant(Complex value) {
        return new Dual(value, Complex.ZERO);
    }

    /// The identity function evaluated at `value`, so its derivative is one.
    public static Dual variable(Complex value) {
        return new Dual(value, Complex.ONE);
    }

    public static Dual one() {
        return new Dual(Complex.ONE, Complex.ZERO);
    }

    public Dual plus(Dual other) {
        return new Dual(value.add(other.value), deriv.add(other.deriv));
    }

    public Dual plus(Complex c) {
        return new Dual(value.add(c), deriv);
    }

    public Dual minus(Dual other) {
        return new Dual(value.subtract(other.value), deriv.subtract(other.deriv));
    }

    public Dual minus(Complex c) {
        return new Dual(value.subtract(c), deriv);
    }

    public Dual times(Dual other) {
        return new Dual(
            value.multiply(other.value),
            deriv.multiply(other.value).add(value.multiply(other.deriv)));
    }

    public Dual times(Complex c) {
        return new Dual(value.multiply(c), deriv.multiply(c));
    }

    public Dual divide(Dual other) {
        Complex denom = other.value.multiply(other.value);
        return new Dual(
            value.divide(other.value),
            deriv.multiply(other.value).subtract(value.multiply(other.deriv)).divide(denom));
    }

    public Dual inverse() {
        Complex inv = Complex.ONE.divide(value);
        return new Dual(inv, deriv.negate().multiply(inv).multiply(inv));
    }

    /// Raises this dual to an integer power. Zero yields the constant one.
    public Dual pow(int n) {
        if (n == 0) {
            return one();
        }
        if (n < 0) {
            return pow(-n).inverse();
        }
        Complex lower = Complexes.powInt(value, n - 1);
        return new Dual(lower.multiply(value), deriv.multiply(lower).multiply(n));
    }

    /// Chain rule. `outer` is a function evaluated at this value, carrying its own
    /// derivative with respect to this value; the result carries the derivative with respect
    /// to whatever this dual was differentiated against.
    ///
    /// @param outer `(g(v), g'(v))` where `v` is this value
    /// @return `(g(v), g'(v) * dv)`
    public Dual compose(Dual outer) {
        return new Dual(outer.value, outer.deriv.multiply(deriv));
    }

    public boolean isFinite() {
        return Complexes.isFinite(value) && Complexes.isFinite(deriv);
    }
}
