package io.nosqlbench.dynamo.core.trace;

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
import io.nosqlbench.dynamo.common.newton.Newton;
import io.nosqlbench.dynamo.common.newton.NewtonResult;
import io.nosqlbench.dynamo.core.family.Equipotential;
import org.apache.commons.math3.complex.Complex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Traces the level curve of the potential through a point.
///
/// The base point is iterated until `|f^n(t0)|^2` exceeds the equipotential escape radius.
/// With `n` held fixed, the target `f^n(t0)` is then rotated in small steps and each
/// preimage is solved for from the previous one. A closed curve needs `d^n` full turns of
/// the target. Steps where Newton fails are left out of the curve, and the next step starts
/// from the last solved point.
public final class EquipotentialTracer<P> {

    private static final Logger logger = LogManager.getLogger(EquipotentialTracer.class);

    private final Equipotential<P> family;
    private final TracerOptions options;

    public EquipotentialTracer(Equipotential<P> family, TracerOptions options) {
        this.family = Objects.requireNonNull(family, "family cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    /// @return the curve through `t0`, starting with `t0` itself
    public Optional<List<Complex>> trace(Complex t0) {
        double degree = Math.abs(family.degreeReal());
        if (!Double.isFinite(degree)) {
            logger.debug("No equipotentials for {}: degree at infinity is not finite", family.name());
            return Optional.empty();
        }

        P c = family.paramMap(t0);
        Complex z = family.startPoint(t0, c);
        int n = 0;
        boolean escaped = false;
        while (n < options.equipotentialMaxIter()) {
            z = family.map(z, c);
            n++;
            if (Complexes.normSqr(z) > options.equipotentialEscapeRadiusSqr()) {
                escaped = true;
                break;
            }
        }
        if (!escaped) {
            logger.debug("No equipotential through {}: orbit stayed bounded for {} iterations", t0, n);
            return Optional.empty();
        }

        Complex base = z;
        int iterations = n;
        long steps = Math.round(Math.pow(degree, n) / options.turnsPerStep());
        List<Complex> curve = new ArrayList<>();
        curve.add(t0);
        Complex t = t0;
        long skipped = 0;
        for (long s = 1; s <= steps; s++) {
            Complex target = base.multiply(Complexes.toCircle(options.turnsPerStep() * s));
            NewtonResult result = Newton.findTargetRelative(x -> family.iterateD(x, iterations), t, target);
            if (result instanceof NewtonResult.Converged converged) {
                t = converged.root();
                curve.add(t);
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            logger.debug("Equipotential through {} skipped {} of {} steps", t0, skipped, steps);
        }
        return Optional.of(curve);
    }
}
