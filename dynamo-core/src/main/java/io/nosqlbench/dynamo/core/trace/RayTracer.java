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
import io.nosqlbench.dynamo.common.symbolic.RationalAngle;
import io.nosqlbench.dynamo.core.family.ExternalRays;
import org.apache.commons.math3.complex.Complex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/// Traces external rays by Newton continuation.
///
/// ## Method
///
/// A point on the ray of angle `theta` at potential level `u` solves
/// `f^n(t) = exp(u + 2 pi i theta d^k)` for a suitable iterate `n`. Round `k` uses
/// `n = k * period + phase` iterations and walks `u` down from `d ln R` in `sharpness`
/// steps, each solved from the previous point:
///
/// ```text
///   u <- u * d^(-1/sharpness) - Re(ln a) / sharpness
///   v <- v - Im(ln a) / sharpness
/// ```
///
/// Between rounds the target angle is multiplied by the degree, so the next round resumes
/// at the potential level where the last one stopped.
///
/// ## Termination
///
/// Continuation ends when
/// - consecutive points come within one pixel width of each other,
/// - Newton produces a non-finite guess, or
/// - all rounds are used.
///
/// Steps where Newton merely fails to converge are skipped. The last few points of a
/// continuation tend to degrade, so the returned iterator drops the trailing run of points
/// whose spacing no longer shrinks (see [TailTrimmingIterator]).
public final class RayTracer<P> {

    private static final Logger logger = LogManager.getLogger(RayTracer.class);

    private final ExternalRays<P> family;
    private final TracerOptions options;

    public RayTracer(ExternalRays<P> family, TracerOptions options) {
        this.family = Objects.requireNonNull(family, "family cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    /// @return the ray points, or empty when the family has no finite degree at infinity
    public Optional<Iterator<Complex>> trace(RationalAngle angle) {
        double degreeReal = Math.abs(family.degreeReal());
        if (!Double.isFinite(degreeReal) || family.degree() < 2) {
            logger.debug("No external rays for {}: degree at infinity is {}", family.name(), family.degreeReal());
            return Optional.empty();
        }
        return Optional.of(new TailTrimmingIterator(new Continuation(angle, degreeReal)));
    }

    /// The untrimmed sequence of converged continuation points.
    private final class Continuation implements Iterator<Complex> {

        private final double logEscapeRadius;
        private final double shrink;
        private final Complex shift;
        private final double pixelWidth;
        private final double acceptError;

        private RationalAngle targetAngle;
        private int round;
        private int step;
        private double u;
        private double v;
        private Complex current;

        private Complex last;
        private Complex pending;
        private boolean exhausted;

        Continuation(RationalAngle angle, double degreeReal) {
            int sharpness = options.sharpness();
            this.logEscapeRadius = Math.log(options.rayEscapeRadius()) * degreeReal;
            this.shrink = Math.pow(degreeReal, -1.0 / sharpness);
            // assumes the escape coefficient does not depend on the parameter
            Complex a = family.escapeCoeff(family.paramMap(Complex.ONE));
            this.shift = a.log().divide(sharpness);
            this.pixelWidth = family.pointGrid().pixelWidth();
            this.acceptError = family.pointGrid().resX() * 1e-8;

            this.targetAngle = family.angleMapLargeParam(angle);
            this.round = 0;
            this.step = 0;
            this.u = logEscapeRadius;
            this.v = targetAngle.toDouble() * Complexes.TAU;
            this.current = angle.toCircle().multiply(options.seedRadius());
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !exhausted) {
                pending = solveNext();
                if (pending == null) {
                    exhausted = true;
                } else {
                    if (last != null && pending.subtract(last).abs() < pixelWidth) {
                        logger.debug("Ray reached pixel resolution in round {} at {}", round, pending);
                        exhausted = true;
                    }
                    last = pending;
                }
            }
            return pending != null;
        }

        @Override
        public Complex next() {
            if (!hasNext()) {
                throw new NoSuchElementException("external ray is exhausted");
            }
            Complex result = pending;
            pending = null;
            return result;
        }

        private Complex solveNext() {
            while (round < options.depth()) {
                if (step == options.sharpness()) {
                    step = 0;
                    round++;
                    if (round >= options.depth()) {
                        break;
                    }
                    targetAngle = targetAngle.multiply(family.degree());
                    u = logEscapeRadius;
                    v = targetAngle.toDouble() * Complexes.TAU;
                }
                int iterations = round * family.escapingPeriod() + family.escapingPhase();
                Complex target = new Complex(u, v).exp();
                NewtonResult result = Newton.findTarget(
                    t -> family.iterateD(t, iterations), current, target, acceptError, Newton.MAX_ITERS);

                u = u * shrink - shift.getReal();
                v = v - shift.getImaginary();
                step++;

                if (result instanceof NewtonResult.Converged converged) {
                    current = converged.root();
                    return current;
                }
                if (result instanceof NewtonResult.NonFinite) {
                    logger.debug("Ray stopped in round {}: Newton diverged", round);
                    return null;
                }
            }
            return null;
        }
    }
}
