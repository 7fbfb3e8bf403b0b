package io.nosqlbench.dynamo.core.family;

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

import io.nosqlbench.dynamo.common.symbolic.RationalAngle;
import org.apache.commons.math3.complex.Complex;

/// Local behavior of the family near infinity, which drives the smooth potential and the
/// external rays.
public interface InfinityFirstReturnMap<P> {

    /// Order of vanishing of the first return map of `1/f(1/z)` at zero. NaN when infinity
    /// is not a superattracting periodic point, in which case rays are unsupported.
    default double degreeReal() {
        return 2.0;
    }

    /// [#degreeReal()] rounded, or zero when it is not finite.
    default int degree() {
        double d = degreeReal();
        return Double.isFinite(d) ? (int) Math.round(d) : 0;
    }

    default boolean hasFiniteDegree() {
        return Double.isFinite(degreeReal());
    }

    /// Period of infinity.
    default int escapingPeriod() {
        return 1;
    }

    /// Iterations before the variable is large, for very large parameters.
    default int escapingPhase() {
        return 1;
    }

    /// Argument reached after [#escapingPhase()] iterations for a large parameter with the
    /// given argument. Seeds the external ray tracer.
    default RationalAngle angleMapLargeParam(RationalAngle angle) {
        return angle;
    }

    /// Leading coefficient of the first return map at infinity.
    default Complex escapeCoeff(P c) {
        return Complex.ONE;
    }
}
