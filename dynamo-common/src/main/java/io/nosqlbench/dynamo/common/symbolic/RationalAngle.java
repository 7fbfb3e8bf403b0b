package io.nosqlbench.dynamo.common.symbolic;

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

import io.nosqlbench.dynamo.common.math.Complexes;
import io.nosqlbench.dynamo.common.math.NumberTheory;
import org.apache.commons.math3.complex.Complex;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/// An external angle `p/q`, measured in turns and kept reduced mod 1.
///
/// Instances are always in lowest terms with `0 <= p < q`. Multiplication by an integer is
/// exact, which is what the angle-doubling (or `d`-tupling) map on external rays needs.
public final class RationalAngle {

    private final long numerator;
    private final long denominator;

    private RationalAngle(long numerator, long denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /// @throws IllegalArgumentException if `denominator` is zero
    public static RationalAngle of(long numerator, long denominator) {
        if (denominator == 0) {
            throw new IllegalArgumentException("angle denominator must be non-zero");
        }
        if (denominator < 0) {
            numerator = -numerator;
            denominator = -denominator;
        }
        long p = Math.floorMod(numerator, denominator);
        long g = NumberTheory.gcd(p, denominator);
        if (g == 0) {
            g = 1;
        }
        return new RationalAngle(p / g, denominator / g);
    }

    public long numerator() {
        return numerator;
    }

    public long denominator() {
        return denominator;
    }

    public RationalAngle multiply(long factor) {
        return of(Math.multiplyExact(numerator, factor), denominator);
    }

    public RationalAngle plus(RationalAngle other) {
        long d = Math.multiplyExact(denominator, other.denominator);
        long n = Math.addExact(
            Math.multiplyExact(numerator, other.denominator),
            Math.multiplyExact(other.numerator, denominator));
        return of(n, d);
    }

    public double toDouble() {
        return (double) numerator / (double) denominator;
    }

    /// @return the point `exp(2 pi i p/q)` on the unit circle
    public Complex toCircle() {
        return Complexes.toCircle(toDouble());
    }

    /// Symbolic orbit of this angle under multiplication by `degree`.
    ///
    /// @return the preperiod and period of the angle
    public OrbitSchema orbitSchema(int degree) {
        if (degree < 2) {
            throw new IllegalArgumentException("degree must be at least 2, got: " + degree);
        }
        Map<RationalAngle, Integer> seen = new HashMap<>();
        RationalAngle angle = this;
        int step = 0;
        while (!seen.containsKey(angle)) {
            seen.put(angle, step++);
            angle = angle.multiply(degree);
        }
        int first = seen.get(angle);
        return new OrbitSchema(first, step - first);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RationalAngle that)) {
            return false;
        }
        return numerator == that.numerator && denominator == that.denominator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(numerator, denominator);
    }

    @Override
    public String toString() {
        return numerator + "/" + denominator;
    }
}
