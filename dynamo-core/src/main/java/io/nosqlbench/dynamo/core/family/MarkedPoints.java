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

import io.nosqlbench.dynamo.common.math.Complexes;
import org.apache.commons.math3.complex.Complex;

import java.util.List;
import java.util.Optional;

/// Marked points are attractors known in advance, such as the roots a Newton map converges
/// to. Orbits ending near one are reported by class instead of as generic cycles.
public interface MarkedPoints<P> {

    /// Marked points of the map with parameter `c`, used when classifying this family.
    default List<Complex> markedPoints(P c) {
        return List.of();
    }

    /// Marked points handed to the dynamical-plane child at parameter `c`.
    default List<Complex> markedPointsChild(P c) {
        return markedPoints(c);
    }

    /// Squared distance within which a final orbit value matches a marked point.
    double markedPointTolerance();

    /// The first marked point within tolerance of `z`, if any.
    default Optional<MarkedPoint> identifyMarkedPoint(Complex z, P c) {
        List<Complex> points = markedPoints(c);
        double tol = markedPointTolerance();
        for (int i = 0; i < points.size(); i++) {
            if (Complexes.distSqr(z, points.get(i)) < tol) {
                return Optional.of(new MarkedPoint(points.get(i), i));
            }
        }
        return Optional.empty();
    }
}
