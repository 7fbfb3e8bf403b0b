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

import io.nosqlbench.dynamo.common.params.OrbitParams;
import io.nosqlbench.dynamo.common.point.PeriodicInfo;
import io.nosqlbench.dynamo.common.point.PointInfo;
import io.nosqlbench.dynamo.core.family.QuadraticFamily;
import io.nosqlbench.dynamo.core.orbit.ComputeMode;
import io.nosqlbench.dynamo.core.orbit.EscapeResult;
import io.nosqlbench.dynamo.core.orbit.OrbitEngine;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
public class EscapeClassifierTest {

    private final QuadraticFamily family = new QuadraticFamily(OrbitParams.defaults());
    private final EscapeClassifier<Complex> classifier = new EscapeClassifier<>(family);

    /// A quadratic family that pretends infinity is not superattracting.
    private static class NoDegreeFamily extends QuadraticFamily {
        NoDegreeFamily() {
            super(OrbitParams.defaults());
        }

        @Override
        public double degreeReal() {
            return Double.NaN;
        }
    }

    @Test
    public void potentialIsContinuousAlongRealAxis() {
        double previous = Double.NaN;
        for (int i = 0; i <= 1500; i++) {
            Complex c = new Complex(0.5 + i * 0.001, 0.0);
            PointInfo info = family.classifyPoint(c);
            assertThat(info).isInstanceOf(PointInfo.Escaping.class);
            double potential = ((PointInfo.Escaping) info).potential();
            if (!Double.isNaN(previous)) {
                assertThat(Math.abs(potential - previous)).as("jump at c=%s", c).isLessThan(0.05);
            }
            previous = potential;
        }
    }

    @Test
    public void potentialAtExactRadiusIsTheIterationCount() {
        double radius = family.escapeRadius();
        double potential = classifier.potential(7, new Complex(radius, 0.0), Complex.ZERO);
        assertThat(potential).isCloseTo(7.0, within(1e-12));
    }

    @Test
    public void nanFinalValueFallsBack() {
        PointInfo info = classifier.classify(new EscapeResult.Escaped(5, Complex.NaN), Complex.ZERO);
        assertThat(info).isEqualTo(new PointInfo.Escaping(4.0));
    }

    @Test
    public void familiesWithoutDegreeUseLogLogResidual() {
        EscapeClassifier<Complex> noDegree = new EscapeClassifier<>(new NoDegreeFamily());
        double radius = OrbitParams.DEFAULT_ESCAPE_RADIUS;
        double potential = noDegree.potential(3, new Complex(radius * radius, 0.0), Complex.ZERO);
        // ln|z|^2 is twice ln R^2, so the residual is ln 2
        assertThat(potential).isCloseTo(3.0 - Math.log(2.0), within(1e-12));
    }

    @Test
    public void boundedFarOrbitsWanderWithoutDegree() {
        EscapeClassifier<Complex> noDegree = new EscapeClassifier<>(new NoDegreeFamily());
        assertThat(noDegree.classify(new EscapeResult.Bounded(new Complex(1000.0, 0.0)), Complex.ZERO))
            .isInstanceOf(PointInfo.Wandering.class);
        assertThat(noDegree.classify(new EscapeResult.Bounded(Complex.ONE), Complex.ZERO))
            .isInstanceOf(PointInfo.Bounded.class);
        assertThat(classifier.classify(new EscapeResult.Bounded(new Complex(1000.0, 0.0)), Complex.ZERO))
            .isInstanceOf(PointInfo.Bounded.class);
    }

    @Test
    public void periodicNearMarkedPointIsMarked() {
        QuadraticFamily marked = new QuadraticFamily(OrbitParams.defaults()) {
            @Override
            public List<Complex> markedPoints(Complex c) {
                return List.of(new Complex(5.0, 0.0), new Complex(0.5, 0.5));
            }

            @Override
            public double markedPointTolerance() {
                return 1e-8;
            }
        };
        PeriodicInfo info = new PeriodicInfo(3, 1, Complex.ZERO, 0.0);
        EscapeClassifier<Complex> markedClassifier = new EscapeClassifier<>(marked);

        PointInfo hit = markedClassifier.classify(new EscapeResult.Periodic(info, new Complex(0.50001, 0.5)), Complex.ZERO);
        assertThat(hit).isEqualTo(new PointInfo.MarkedPoint(new Complex(0.5, 0.5), 1, 2));

        PointInfo miss = markedClassifier.classify(new EscapeResult.Periodic(info, new Complex(0.6, 0.5)), Complex.ZERO);
        assertThat(miss).isEqualTo(new PointInfo.Periodic(info));
    }

    @Test
    public void interiorSeamIsPluggable() {
        EscapeClassifier<Complex> custom = new EscapeClassifier<>(family, info -> new PointInfo.Escaping(-info.period()));
        PeriodicInfo info = new PeriodicInfo(0, 3, Complex.ZERO, 0.0);
        assertThat(custom.classify(new EscapeResult.Periodic(info, Complex.ZERO), Complex.ZERO))
            .isEqualTo(new PointInfo.Escaping(-3.0));
    }

    @Test
    public void knownPotentialPassesThrough() {
        PointInfo known = new PointInfo.Escaping(1.25);
        assertThat(classifier.classify(new EscapeResult.KnownPotential(known), Complex.ZERO)).isSameAs(known);
    }

    @Test
    public void distanceEstimateOutsideTheSet() {
        // c = 1 escapes after 7 steps; the nearest boundary point is 1/4
        PointInfo info = family.classifyPoint(Complex.ONE, ComputeMode.DISTANCE_ESTIMATION);
        assertThat(info).isInstanceOf(PointInfo.DistanceEstimate.class);
        PointInfo.DistanceEstimate estimate = (PointInfo.DistanceEstimate) info;
        assertThat(estimate.distance()).isBetween(0.3, 1.5);
        assertThat(estimate.phase()).isZero();
    }

    @Test
    public void distanceEstimateShrinksTowardTheBoundary() {
        double far = ((PointInfo.DistanceEstimate) family.classifyPoint(new Complex(2.0, 0.0), ComputeMode.DISTANCE_ESTIMATION)).distance();
        double near = ((PointInfo.DistanceEstimate) family.classifyPoint(new Complex(0.5, 0.5), ComputeMode.DISTANCE_ESTIMATION)).distance();
        assertThat(near).isLessThan(far);
    }

    @Test
    public void distanceEstimationLeavesTheInteriorAlone() {
        assertThat(family.classifyPoint(Complex.ZERO, ComputeMode.DISTANCE_ESTIMATION))
            .isEqualTo(family.classifyPoint(Complex.ZERO))
            .isInstanceOf(PointInfo.Periodic.class);
    }

    @Test
    public void vanishingDerivativeFallsBackToPotential() {
        EscapeResult.Escaped escaped = new EscapeResult.Escaped(5, new Complex(1e7, 0.0));
        PointInfo info = classifier.distanceEstimate(escaped, Complex.ZERO, Complex.ZERO);
        assertThat(info).isEqualTo(classifier.classify(escaped, Complex.ZERO));
    }

    @Test
    public void distanceEstimationNeedsATrackingEngine() {
        OrbitEngine<Complex> engine = new OrbitEngine<>(family);
        engine.reset(Complex.ONE);
        EscapeResult result = engine.runUntilComplete();
        assertThatThrownBy(() -> classifier.classify(engine, result, ComputeMode.DISTANCE_ESTIMATION))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(classifier.classify(engine, result, ComputeMode.SMOOTH_POTENTIAL))
            .isEqualTo(classifier.classify(result, engine.param()));
    }

    @Test
    public void computeModesCycle() {
        assertThat(ComputeMode.SMOOTH_POTENTIAL.cycle()).isEqualTo(ComputeMode.DISTANCE_ESTIMATION);
        assertThat(ComputeMode.DISTANCE_ESTIMATION.cycle()).isEqualTo(ComputeMode.SMOOTH_POTENTIAL);
        assertThat(ComputeMode.SMOOTH_POTENTIAL.tracksDerivative()).isFalse();
    }
}
