package io.nosqlbench.dynamo.profiles;

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

import io.nosqlbench.dynamo.common.point.PeriodicInfo;
import io.nosqlbench.dynamo.common.point.PointInfo;
import io.nosqlbench.dynamo.common.symbolic.OrbitSchema;
import io.nosqlbench.dynamo.core.family.CoveringMap;
import io.nosqlbench.dynamo.core.family.Mapped;
import io.nosqlbench.dynamo.core.locate.LocatorResult;
import io.nosqlbench.dynamo.core.locate.PointLocator;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
public class MandelbrotCoversTest {

    private final Mandelbrot mandelbrot = new Mandelbrot();

    @Test
    public void misiurewiczCoverCentersOnTheTip() {
        CoveringMap cover = MandelbrotCovers.misiurewicz21(mandelbrot);
        assertThat(cover.paramMap(Complex.ZERO).getReal()).isCloseTo(-2.0, within(1e-15));

        PointInfo info = cover.classifyPoint(Complex.ZERO);
        assertThat(info).isInstanceOf(PointInfo.Periodic.class);
        PeriodicInfo periodic = ((PointInfo.Periodic) info).info();
        assertThat(periodic.preperiod()).isEqualTo(2);
        assertThat(periodic.period()).isEqualTo(1);
        assertThat(periodic.multiplier().getReal()).isCloseTo(4.0, within(1e-12));
    }

    @Test
    public void fixedPointCoverLocatesTheCenter() {
        CoveringMap cover = MandelbrotCovers.markedFixedPoint(mandelbrot);
        LocatorResult result = PointLocator.find(cover, new Complex(0.4, 0.0), new OrbitSchema(0, 1));
        assertThat(result).isInstanceOf(LocatorResult.Found.class);
        assertThat(((LocatorResult.Found) result).point().getReal()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    public void fixedPointCoverStaysInsideTheCardioid() {
        CoveringMap cover = MandelbrotCovers.markedFixedPoint(mandelbrot);
        Mapped<Complex> mapped = cover.paramMapD(new Complex(0.1, 0.0));
        assertThat(mapped.param().getReal()).isCloseTo(0.24, within(1e-15));
        assertThat(mapped.derivative().getReal()).isCloseTo(-0.2, within(1e-15));
        assertThat(cover.classifyPoint(new Complex(0.1, 0.0))).isInstanceOf(PointInfo.PeriodicKnownPotential.class);
    }

    @Test
    public void twoCycleCoverHitsTheBasilica() {
        CoveringMap cover = MandelbrotCovers.markedTwoCycle(mandelbrot);
        assertThat(cover.paramMap(Complex.ZERO).getReal()).isCloseTo(-1.0, within(1e-15));
        assertThat(cover.name()).isEqualTo("Mandelbrot marked 2-cycle");
        assertThat(cover.pointGrid().bounds()).isEqualTo(MandelbrotCovers.COVER_BOUNDS);
    }
}
