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

/// What a plane computation measures for points whose orbit escapes.
///
/// Bounded orbits are classified the same way in both modes.
public enum ComputeMode {
    /// Smooth escape potential from the escape count and the final radius.
    SMOOTH_POTENTIAL,
    /// Estimated distance to the boundary, from the derivative carried along the orbit.
    DISTANCE_ESTIMATION;

    /// Whether orbits in this mode need `dz/dt` alongside the value.
    public boolean tracksDerivative() {
        return this == DISTANCE_ESTIMATION;
    }

    /// The other mode.
    public ComputeMode cycle() {
        return this == SMOOTH_POTENTIAL ? DISTANCE_ESTIMATION : SMOOTH_POTENTIAL;
    }
}
