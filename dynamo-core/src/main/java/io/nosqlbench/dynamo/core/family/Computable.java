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

import io.nosqlbench.dynamo.common.point.PointInfo;
import io.nosqlbench.dynamo.core.classify.EscapeClassifier;
import io.nosqlbench.dynamo.core.orbit.ComputeMode;
import io.nosqlbench.dynamo.core.orbit.EscapeResult;
import io.nosqlbench.dynamo.core.orbit.OrbitAndInfo;
import io.nosqlbench.dynamo.core.orbit.OrbitEngine;
import io.nosqlbench.dynamo.core.orbit.PotentialEvaluator;
import io.nosqlbench.dynamo.core.orbit.PotentialGradient;
import org.apache.commons.math3.complex.Complex;

import java.util.Optional;
import java.util.OptionalDouble;

/// A family that can be classified point by point.
public interface Computable<P> extends DynamicalFamily<P>, InfinityFirstReturnMap<P>, MarkedPoints<P> {

    @Override
    default double markedPointTolerance() {
        return periodicityTolerance();
    }

    /// Classifies a single selected point.
    default PointInfo classifyPoint(Complex t) {
        OrbitEngine<P> engine = new OrbitEngine<>(this);
        engine.reset(t);
        EscapeResult result = engine.runUntilComplete();
        return new EscapeClassifier<>(this).classify(result, engine.param());
    }

    /// Classifies a single selected point the way a plane computed in `mode` would.
    default PointInfo classifyPoint(Complex t, ComputeMode mode) {
        OrbitEngine<P> engine = new OrbitEngine<>(this, false, mode.tracksDerivative());
        engine.reset(t);
        EscapeResult result = engine.runUntilComplete();
        return new EscapeClassifier<>(this).classify(engine, result, mode);
    }

    /// External potential of the selected point with its gradient along `t`.
    ///
    /// @return empty for bounded orbits and wherever the value is not finite
    /// @see PotentialEvaluator
    default Optional<PotentialGradient> externalPotentialD(Complex t) {
        return new PotentialEvaluator<>(this).evaluate(t);
    }

    /// Distance from the selected point to the zero level of its external potential,
    /// estimated as `G / |grad G|`.
    default OptionalDouble externalDistanceEstimate(Complex t) {
        Optional<PotentialGradient> potential = externalPotentialD(t);
        if (potential.isEmpty()) {
            return OptionalDouble.empty();
        }
        double distance = potential.get().distanceEstimate();
        return Double.isFinite(distance) ? OptionalDouble.of(distance) : OptionalDouble.empty();
    }

    /// Classifies a single selected point and returns the orbit it traced.
    default OrbitAndInfo<P> orbitAndInfo(Complex t) {
        OrbitEngine<P> engine = new OrbitEngine<>(this, true);
        engine.reset(t);
        EscapeResult result = engine.runUntilComplete();
        PointInfo info = new EscapeClassifier<>(this).classify(result, engine.param());
        return new OrbitAndInfo<>(engine.param(), engine.start(), engine.visited(), info);
    }
}
