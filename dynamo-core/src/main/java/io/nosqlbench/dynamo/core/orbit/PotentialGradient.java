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

import org.apache.commons.math3.complex.Complex;

/// External potential of a point with its gradient along the selection coordinate.
///
/// The gradient is stored conjugated, `conj(dG/dt)`, so that its direction points uphill in
/// the plane.
public record PotentialGradient(double potential, Complex gradient) {

    /// Distance estimate `G / |grad G|` to the level set where the potential vanishes.
    public double distanceEstimate() {
        return potential / gradient.abs();
    }
}
