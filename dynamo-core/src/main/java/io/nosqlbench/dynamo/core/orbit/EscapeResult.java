package io.nosqlbench.dynamo.core.orbit;

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

import io.nosqlbench.dynamo.common.point.PeriodicInfo;
import io.nosqlbench.dynamo.common.point.PointInfo;
import org.apache.commons.math3.complex.Complex;

/// Raw outcome of running one orbit, before it is encoded as a [PointInfo].
public sealed interface EscapeResult
    permits EscapeResult.Escaped, EscapeResult.Periodic, EscapeResult.Bounded, EscapeResult.KnownPotential {

    /// The orbit left the escape disk or became NaN.
    ///
    /// @param iters number of map applications on the fast orbit
    /// @param finalValue the first value outside the disk
    record Escaped(int iters, Complex finalValue) implements EscapeResult {
    }

    record Periodic(PeriodicInfo info, Complex finalValue) implements EscapeResult {
    }

    record Bounded(Complex finalValue) implements EscapeResult {
    }

    /// The family answered without iterating.
    record KnownPotential(PointInfo info) implements EscapeResult {
    }
}
