package io.nosqlbench.dynamo.core.locate;

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

import io.nosqlbench.dynamo.common.newton.NewtonResult;
import io.nosqlbench.dynamo.common.symbolic.OrbitSchema;
import io.nosqlbench.dynamo.core.family.QuadraticFamily;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
public class PointLocatorTest {

    private final QuadraticFamily family = new QuadraticFamily();

    private static Complex found(LocatorResult result) {
        assertThat(result).isInstanceOf(LocatorResult.Found.class);
        return ((LocatorResult.Found) result).point();
    }

    @Test
    public void findsAirplaneCenter() {
        Complex c = found(PointLocator.find(family, new Complex(-1.75, 0.0), new OrbitSchema(0, 3)));
        assertThat(c.getReal()).isCloseTo(-1.7548776662466927, within(1e-9));
        assertThat(c.getImaginary()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    public void findsRabbitCenter() {
        Complex c = found(PointLocator.find(family, new Complex(-0.1, 0.75), new OrbitSchema(0, 3)));
        assertThat(c.getReal()).isCloseTo(-0.12256116687665361, within(1e-9));
        assertThat(c.getImaginary()).isCloseTo(0.7448617666197442, within(1e-9));
    }

    @Test
    public void periodFourSkipsPeriodTwo() {
        // a seed on top of the period-2 center must not be drawn to it
        LocatorResult result = PointLocator.find(family, new Complex(-1.3, 0.0), new OrbitSchema(0, 4));
        Complex c = found(result);
        assertThat(c.getReal()).isCloseTo(-1.3107026413368328, within(1e-9));
    }

    @Test
    public void findsMisiurewiczTip() {
        Complex c = found(PointLocator.find(family, new Complex(-1.9, 0.0), new OrbitSchema(2, 1)));
        assertThat(c.getReal()).isCloseTo(-2.0, within(1e-9));
    }

    @Test
    public void periodZeroHasNoPoints() {
        assertThat(PointLocator.find(family, Complex.ZERO, new OrbitSchema(0, 0)))
            .isInstanceOf(LocatorResult.PeriodIsZero.class);
    }

    @Test
    public void nonFiniteSeedReportsNewtonFailure() {
        LocatorResult result = PointLocator.find(family, Complex.NaN, new OrbitSchema(0, 3));
        assertThat(result).isInstanceOf(LocatorResult.NewtonFailed.class);
        assertThat(((LocatorResult.NewtonFailed) result).failure()).isInstanceOf(NewtonResult.NonFinite.class);
    }
}
