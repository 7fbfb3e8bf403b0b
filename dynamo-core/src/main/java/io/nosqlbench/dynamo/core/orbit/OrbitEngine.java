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
import io.nosqlbench.dynamo.common.math.Dual;
import io.nosqlbench.dynamo.common.params.OrbitParams;
import io.nosqlbench.dynamo.common.point.PeriodicInfo;
import io.nosqlbench.dynamo.common.point.PointInfo;
import io.nosqlbench.dynamo.core.family.DynamicalFamily;
import io.nosqlbench.dynamo.core.family.Gradient;
import io.nosqlbench.dynamo.core.family.Mapped;
import org.apache.commons.math3.complex.Complex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Runs a single orbit to completion with Floyd's tortoise and hare.
///
/// ## Rounds
///
/// Each round advances the slow orbit by one map application and the fast orbit by two.
/// After every fast step the orbit is checked for escape; after the second step, once
/// [OrbitParams#minIter()] rounds have passed, slow and fast are compared for a cycle.
///
/// ```text
///   round r:  slow = f(slow)  fast = f(fast)  escape?  fast = f(fast)  escape?  cycle?
///   map applications on fast:      2r-1                     2r
/// ```
///
/// ## Cycle acceptance
///
/// When slow and fast come within a few tolerances of each other, the cycle through the
/// fast point is walked to find its minimal period `p` and multiplier `m`. The candidate is
/// accepted if `|slow - fast|^2 / max(|1 - m|^2, tol) < tol`, which keeps the test honest
/// near weakly attracting cycles where convergence is slow.
///
/// ## Derivative tracking
///
/// An engine built with derivative tracking also carries `dz/dt`, the derivative of the fast
/// value with respect to the selected point, through [DynamicalFamily#gradient]:
///
/// ```text
///   dz/dt <- df/dz * dz/dt + df/dc * dc/dt
/// ```
///
/// Distance estimation and the external potential read it through [#derivative()].
///
/// Engines are not thread safe. One engine serves one thread and is reused across points
/// through [#reset(Complex)].
public final class OrbitEngine<P> {

    /// Slack on the raw distance before a cycle walk is attempted.
    static final double CANDIDATE_FACTOR = 4.0;
    /// Exponent applied to the tolerance when closing the cycle walk.
    static final double CLOSURE_EXPONENT = 0.75;

    private final DynamicalFamily<P> family;
    private final boolean recordOrbit;
    private final boolean trackDerivative;
    private final List<Complex> visited = new ArrayList<>();

    private P param;
    private Complex start;
    private Complex slow;
    private Complex fast;
    private int rounds;
    private Complex dzdt = Complex.ZERO;
    private Complex dcdt = Complex.ONE;

    private int maxIter;
    private int minIter;
    private double tolerance;
    private double escapeRadiusSqr;

    public OrbitEngine(DynamicalFamily<P> family) {
        this(family, false);
    }

    /// @param recordOrbit keep every fast value for [#visited()]
    public OrbitEngine(DynamicalFamily<P> family, boolean recordOrbit) {
        this(family, recordOrbit, false);
    }

    /// @param recordOrbit keep every fast value for [#visited()]
    /// @param trackDerivative carry `dz/dt` alongside the fast orbit
    public OrbitEngine(DynamicalFamily<P> family, boolean recordOrbit, boolean trackDerivative) {
        this.family = Objects.requireNonNull(family, "family cannot be null");
        this.recordOrbit = recordOrbit;
        this.trackDerivative = trackDerivative;
    }

    /// Seeds the orbit for a selected point of the plane.
    public void reset(Complex selection) {
        if (!trackDerivative) {
            P c = family.paramMap(selection);
            reset(family.startPoint(selection, c), c);
            return;
        }
        Mapped<P> mapped = family.paramMapD(selection);
        Gradient startD = family.startPointD(selection, mapped.param());
        reset(startD.value(), mapped.param());
        this.dcdt = mapped.derivative();
        this.dzdt = startD.chain(Complex.ONE, dcdt);
    }

    /// Seeds the orbit with an explicit start point and parameter. A tracked derivative is
    /// taken with respect to the parameter itself, starting from zero.
    public void reset(Complex z0, P c) {
        OrbitParams params = family.orbitParams();
        this.maxIter = params.maxIter();
        this.minIter = params.minIter();
        this.tolerance = params.periodicityTolerance();
        double radius = params.escapeRadius();
        this.escapeRadiusSqr = radius * radius;

        this.param = c;
        this.start = z0;
        this.slow = z0;
        this.fast = z0;
        this.rounds = 0;
        this.dzdt = Complex.ZERO;
        this.dcdt = Complex.ONE;
        visited.clear();
        if (recordOrbit) {
            visited.add(z0);
        }
    }

    public EscapeResult runUntilComplete() {
        return runUntilComplete(true);
    }

    /// @param consultEarlyBailout whether the family's closed-form answers may end the run
    ///                            before the first round
    public EscapeResult runUntilComplete(boolean consultEarlyBailout) {
        if (param == null) {
            throw new IllegalStateException("reset must be called before running an orbit");
        }
        if (consultEarlyBailout) {
            Optional<PointInfo> known = family.earlyBailout(start, param);
            if (known.isPresent()) {
                return new EscapeResult.KnownPotential(known.get());
            }
        }

        while (true) {
            if (rounds >= maxIter) {
                return new EscapeResult.Bounded(fast);
            }
            rounds++;

            slow = family.map(slow, param);
            stepFast();
            if (escaped()) {
                return new EscapeResult.Escaped(2 * rounds - 1, fast);
            }

            stepFast();
            if (escaped()) {
                return new EscapeResult.Escaped(2 * rounds, fast);
            }

            if (rounds >= minIter && tolerance > 0.0) {
                EscapeResult.Periodic periodic = checkPeriodicity();
                if (periodic != null) {
                    return periodic;
                }
            }
        }
    }

    /// Number of completed tortoise/hare rounds.
    public int rounds() {
        return rounds;
    }

    public P param() {
        return param;
    }

    public Complex start() {
        return start;
    }

    public boolean tracksDerivative() {
        return trackDerivative;
    }

    /// `dz/dt` at the current fast value. Zero unless derivatives are tracked.
    public Complex derivative() {
        return dzdt;
    }

    /// `dc/dt` at the selected point.
    public Complex paramDerivative() {
        return dcdt;
    }

    /// Fast-orbit values seen since the last reset, when recording is on.
    public List<Complex> visited() {
        return Collections.unmodifiableList(new ArrayList<>(visited));
    }

    private void stepFast() {
        if (trackDerivative) {
            Gradient g = family.gradient(fast, param);
            dzdt = g.chain(dzdt, dcdt);
            fast = g.value();
        } else {
            fast = family.map(fast, param);
        }
        if (recordOrbit) {
            visited.add(fast);
        }
    }

    private boolean escaped() {
        double norm = Complexes.normSqr(fast);
        return Double.isNaN(norm) || norm > escapeRadiusSqr;
    }

    private EscapeResult.Periodic checkPeriodicity() {
        double error = Complexes.distSqr(slow, fast);
        if (!(error < CANDIDATE_FACTOR * tolerance)) {
            return null;
        }

        double closure = Math.pow(tolerance, CLOSURE_EXPONENT);
        Complex z = fast;
        Complex multiplier = Complex.ONE;
        int period = 0;
        for (int i = 1; i <= rounds; i++) {
            Dual step = family.mapAndMultiplier(z, param);
            z = step.value();
            multiplier = multiplier.multiply(step.deriv());
            if (Complexes.distSqr(z, fast) <= closure) {
                period = i;
                break;
            }
        }
        if (period == 0) {
            // walk never closed; the loop of length `rounds` is the best available
            period = rounds;
        }

        double attraction = Math.max(Complexes.normSqr(Complex.ONE.subtract(multiplier)), tolerance);
        if (!(error / attraction < tolerance)) {
            return null;
        }
        PeriodicInfo info = new PeriodicInfo(preperiod(period), period, multiplier, error);
        return new EscapeResult.Periodic(info, fast);
    }

    /// Replays the orbit from the start to find the first point within tolerance of its
    /// image `period` steps later.
    private int preperiod(int period) {
        Complex a = start;
        Complex b = start;
        for (int i = 0; i < period; i++) {
            b = family.map(b, param);
        }
        int limit = 2 * rounds;
        for (int i = 0; i < limit; i++) {
            if (Complexes.distSqr(a, b) < tolerance) {
                return i;
            }
            a = family.map(a, param);
            b = family.map(b, param);
        }
        return limit;
    }
}
