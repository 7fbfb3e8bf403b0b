package io.nosqlbench.dynamo.common.point;

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

/// Classification of a single point of a parameter or dynamical plane.
///
/// Instances are immutable; the same family state and coordinate always produce an equal
/// value.
public sealed interface PointInfo permits PointInfo.Bounded, PointInfo.Wandering, PointInfo.Escaping,
    PointInfo.Periodic, PointInfo.PeriodicKnownPotential, PointInfo.MarkedPoint, PointInfo.DistanceEstimate {

    /// The iteration budget ran out with the orbit still bounded.
    record Bounded() implements PointInfo {
    }

    /// The orbit stays finite but is far from any attractor, for families with no finite
    /// degree at infinity.
    record Wandering() implements PointInfo {
    }

    /// The orbit escaped.
    ///
    /// @param potential smooth iteration count
    record Escaping(double potential) implements PointInfo {
    }

    /// The orbit escaped, measured by its distance to the boundary instead of its potential.
    ///
    /// @param distance estimated distance from the point to the boundary of the set
    /// @param phase escape count modulo the period of infinity
    record DistanceEstimate(double distance, int phase) implements PointInfo {
    }

    record Periodic(PeriodicInfo info) implements PointInfo {
    }

    record PeriodicKnownPotential(KnownPotentialInfo info) implements PointInfo {
    }

    /// The orbit converged to one of the family's marked points.
    ///
    /// @param data the marked point itself
    /// @param classId index of the marked point
    /// @param numPointClasses total number of marked points
    record MarkedPoint(Complex data, int classId, int numPointClasses) implements PointInfo {
    }

    static PointInfo bounded() {
        return new Bounded();
    }
}
