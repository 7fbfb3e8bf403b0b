package io.nosqlbench.dynamo.core.classify;

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
import io.nosqlbench.dynamo.common.point.PointInfo;
import io.nosqlbench.dynamo.core.family.Computable;
import io.nosqlbench.dynamo.core.family.MarkedPoint;
import io.nosqlbench.dynamo.core.orbit.ComputeMode;
import io.nosqlbench.dynamo.core.orbit.EscapeResult;
import io.nosqlbench.dynamo.core.orbit.OrbitEngine;
import org.apache.commons.math3.complex.Complex;

import java.util.Objects;
import java.util.Optional;

/// Turns an [EscapeResult] into the [PointInfo] stored in a plane.
///
/// Escaping orbits get a smooth potential
///
/// ```text
///   iters + period * log_d( (ln R^2 + 2q) / (ln |z|^2 + 2q) ),   q = ln|a| / (d - 1)
/// ```
///
/// where `d` is the degree at infinity, `R` the escape radius and `a` the escape
/// coefficient. This is continuous across the jumps of the integer escape count.
///
/// In [ComputeMode#DISTANCE_ESTIMATION] they get a [PointInfo.DistanceEstimate] instead.
public final class EscapeClassifier<P> {

    /// Squared modulus above which a bounded orbit of a family without a finite degree at
    /// infinity is reported as wandering.
    public static final double WANDERING_NORM_SQR = 1e5;

    private final Computable<P> family;
    private final InteriorClassifier interior;

    public EscapeClassifier(Computable<P> family) {
        this(family, InteriorClassifier.PERIODIC);
    }

    public EscapeClassifier(Computable<P> family, InteriorClassifier interior) {
        this.family = Objects.requireNonNull(family, "family cannot be null");
        this.interior = Objects.requireNonNull(interior, "interior classifier cannot be null");
    }

    public PointInfo classify(EscapeResult result, P c) {
        if (result instanceof EscapeResult.Escaped escaped) {
            return new PointInfo.Escaping(potential(escaped.iters(), escaped.finalValue(), c));
        }
        if (result instanceof EscapeResult.Periodic periodic) {
            Optional<MarkedPoint> marked = family.identifyMarkedPoint(periodic.finalValue(), c);
            if (marked.isPresent()) {
                MarkedPoint point = marked.get();
                return new PointInfo.MarkedPoint(point.point(), point.classId(), family.markedPoints(c).size());
            }
            return interior.classify(periodic.info());
        }
        if (result instanceof EscapeResult.KnownPotential known) {
            return known.info();
        }
        Complex last = ((EscapeResult.Bounded) result).finalValue();
        if (!family.hasFiniteDegree() && Complexes.normSqr(last) > WANDERING_NORM_SQR) {
            return new PointInfo.Wandering();
        }
        return new PointInfo.Bounded();
    }

    /// Classifies the result of the orbit the engine just ran, measuring escaping points the
    /// way the mode asks for.
    ///
    /// @throws IllegalArgumentException if the mode needs a derivative the engine did not track
    public PointInfo classify(OrbitEngine<P> engine, EscapeResult result, ComputeMode mode) {
        if (mode.tracksDerivative() && !engine.tracksDerivative()) {
            throw new IllegalArgumentException(mode + " needs an engine that tracks derivatives");
        }
        if (mode == ComputeMode.DISTANCE_ESTIMATION && result instanceof EscapeResult.Escaped escaped) {
            return distanceEstimate(escaped, engine.derivative(), engine.param());
        }
        return classify(result, engine.param());
    }

    /// Distance from an escaped point to the boundary, `|z| ln|z| / |dz/dt|`.
    ///
    /// Falls back to the smooth potential when the derivative overflowed or vanished.
    public PointInfo distanceEstimate(EscapeResult.Escaped escaped, Complex dzdt, P c) {
        double radius = escaped.finalValue().abs();
        double distance = radius * Math.log(radius) / dzdt.abs();
        if (!Double.isFinite(distance)) {
            return new PointInfo.Escaping(potential(escaped.iters(), escaped.finalValue(), c));
        }
        return new PointInfo.DistanceEstimate(distance, escaped.iters() % Math.max(1, family.escapingPeriod()));
    }

    /// Smooth iteration count for an orbit that escaped after `iters` map applications.
    public double potential(int iters, Complex finalValue, P c) {
        double normSqr = Complexes.normSqr(finalValue);
        if (!Double.isFinite(normSqr)) {
            return iters - 1;
        }
        double logRadiusSqr = 2.0 * Math.log(family.escapeRadius());
        double logNormSqr = Math.log(normSqr);
        double degree = Math.abs(family.degreeReal());
        if (!Double.isFinite(degree)) {
            return iters - Math.log(logNormSqr / logRadiusSqr);
        }
        double q = degree == 1.0 ? 0.0 : Math.log(family.escapeCoeff(c).abs()) / (degree - 1.0);
        double residual = Math.log((logRadiusSqr + 2.0 * q) / (logNormSqr + 2.0 * q)) / Math.log(degree);
        return iters + family.escapingPeriod() * residual;
    }
}
