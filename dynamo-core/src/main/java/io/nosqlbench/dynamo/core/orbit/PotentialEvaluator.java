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

import io.nosqlbench.dynamo.common.math.Complexes;
import io.nosqlbench.dynamo.core.family.Computable;
import io.nosqlbench.dynamo.core.family.Gradient;
import io.nosqlbench.dynamo.core.family.Mapped;
import org.apache.commons.math3.complex.Complex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/// External potential of a selected point, with its gradient along the selection.
///
/// ## Escaping orbits
///
/// The Green's function of infinity, read off the escaped value `z` after `n` map
/// applications of a map of degree `d`:
///
/// ```text
///   G = ln|z| / d^n          conj(dG/dt) = conj(dz/dt / z) / d^n
/// ```
///
/// ## Attracting cycles
///
/// Points drawn to a cycle of period `p` and multiplier `m` get the potential of the cycle
/// instead. When `|m| > 1e-10` this is the Koenigs coordinate: the fast point is stepped
/// `p` more times and the potential is `ln|err| / -ln|m|` with `err = (f^p(z) - z) / tol`.
///
/// Superattracting cycles use the Böttcher coordinate. The orbit is restarted with a second
/// copy `p` steps ahead, both are advanced together until they meet within tolerance after
/// `k` steps, and
///
/// ```text
///   phi = ln( ln|err|^2 / ln tol ) + k ln 2
/// ```
///
/// which assumes the cycle has local degree two.
///
/// Bounded orbits, and any result that overflows, have no potential. The family's early
/// bailout is not consulted since it carries no derivative.
public final class PotentialEvaluator<P> {

    private static final Logger logger = LogManager.getLogger(PotentialEvaluator.class);

    /// Multiplier modulus at or below which a cycle is treated as superattracting.
    public static final double SUPERATTRACTING_THRESHOLD = 1e-10;

    private static final double LN_2 = Math.log(2.0);

    private final Computable<P> family;
    private final OrbitEngine<P> engine;

    public PotentialEvaluator(Computable<P> family) {
        this.family = Objects.requireNonNull(family, "family cannot be null");
        this.engine = new OrbitEngine<>(family, false, true);
    }

    public Optional<PotentialGradient> evaluate(Complex selection) {
        engine.reset(selection);
        EscapeResult result = engine.runUntilComplete(false);

        Optional<PotentialGradient> value = Optional.empty();
        if (result instanceof EscapeResult.Escaped escaped) {
            value = green(escaped);
        } else if (result instanceof EscapeResult.Periodic periodic) {
            double multiplierNorm = periodic.info().multiplier().abs();
            int period = periodic.info().period();
            value = multiplierNorm <= SUPERATTRACTING_THRESHOLD
                ? bottcher(selection, period)
                : koenigs(periodic.finalValue(), period, multiplierNorm);
        }
        return value.filter(v -> {
            boolean finite = Double.isFinite(v.potential()) && Complexes.isFinite(v.gradient());
            if (!finite) {
                logger.debug("Dropping non-finite potential {} at {} for {}", v, selection, family.name());
            }
            return finite;
        });
    }

    private Optional<PotentialGradient> green(EscapeResult.Escaped escaped) {
        if (!family.hasFiniteDegree()) {
            return Optional.empty();
        }
        double rescale = Math.pow(Math.abs(family.degreeReal()), -escaped.iters());
        Complex z = escaped.finalValue();
        double potential = Math.log(z.abs()) * rescale;
        Complex gradient = engine.derivative().divide(z).conjugate().multiply(rescale);
        return Optional.of(new PotentialGradient(potential, gradient));
    }

    private Optional<PotentialGradient> koenigs(Complex fast, int period, double multiplierNorm) {
        double tolerance = family.periodicityTolerance();
        P c = engine.param();
        Complex dcdt = engine.paramDerivative();
        Complex dzdt = engine.derivative();

        Complex z = fast;
        Complex dz = dzdt;
        for (int i = 0; i < period; i++) {
            Gradient g = family.gradient(z, c);
            dz = g.chain(dz, dcdt);
            z = g.value();
        }

        Complex err = z.subtract(fast).divide(tolerance);
        Complex derr = dz.subtract(dzdt).divide(tolerance);
        double scale = -Math.log(multiplierNorm);
        double potential = Math.log(err.abs()) / scale;
        Complex gradient = derr.divide(err).conjugate().negate().divide(scale);
        return Optional.of(new PotentialGradient(potential, gradient));
    }

    private Optional<PotentialGradient> bottcher(Complex selection, int period) {
        double tolerance = family.periodicityTolerance();
        Mapped<P> mapped = family.paramMapD(selection);
        P c = mapped.param();
        Complex dcdt = mapped.derivative();
        Gradient start = family.startPointD(selection, c);

        Complex slow = start.value();
        Complex dslow = start.chain(Complex.ONE, dcdt);
        Complex fast = slow;
        Complex dfast = dslow;
        for (int i = 0; i < period; i++) {
            Gradient g = family.gradient(fast, c);
            dfast = g.chain(dfast, dcdt);
            fast = g.value();
        }

        int limit = family.orbitParams().maxIter();
        int steps = 0;
        while (Complexes.distSqr(fast, slow) > tolerance) {
            if (steps >= limit) {
                return Optional.empty();
            }
            Gradient gs = family.gradient(slow, c);
            dslow = gs.chain(dslow, dcdt);
            slow = gs.value();
            Gradient gf = family.gradient(fast, c);
            dfast = gf.chain(dfast, dcdt);
            fast = gf.value();
            steps++;
        }

        Complex err = fast.subtract(slow);
        Complex derr = dfast.subtract(dslow);
        double normErr = Complexes.normSqr(err);
        double logNormErr = Math.log(normErr);
        double potential = Math.log(logNormErr / Math.log(tolerance)) + steps * LN_2;
        Complex gradient = err.multiply(derr.divide(logNormErr * normErr).conjugate());
        return Optional.of(new PotentialGradient(potential, gradient));
    }
}
