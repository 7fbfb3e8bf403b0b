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

import io.nosqlbench.dynamo.common.grid.Bounds;
import io.nosqlbench.dynamo.common.grid.PointGrid;
import io.nosqlbench.dynamo.common.math.Dual;
import io.nosqlbench.dynamo.common.params.ParamList;
import io.nosqlbench.dynamo.common.params.ParamStack;
import org.apache.commons.math3.complex.Complex;

import java.util.List;
import java.util.Objects;

/// The dynamical plane of a parent family at a fixed parameter.
///
/// The selected point is the start point itself and the parameter never moves, so the
/// parameter derivative is zero. Marked points come from the parent's
/// [MarkedPoints#markedPointsChild(Object)].
public class JuliaSet<P> extends AbstractFractalFamily<P> {

    public static final Bounds DEFAULT_BOUNDS = new Bounds(-2.0, 2.0, -2.0, 2.0);

    private final FractalFamily<P> parent;
    private final P param;

    public JuliaSet(FractalFamily<P> parent, P param) {
        this(parent, param, new PointGrid(parent.pointGrid().resX(), parent.pointGrid().resX(), DEFAULT_BOUNDS));
    }

    public JuliaSet(FractalFamily<P> parent, P param, PointGrid grid) {
        super(grid, parent.orbitParams().toBuilder()
            .periodicityTolerance(grid.bounds().area() * TOLERANCE_PER_AREA)
            .build());
        this.parent = Objects.requireNonNull(parent, "parent cannot be null");
        this.param = Objects.requireNonNull(param, "param cannot be null");
    }

    public FractalFamily<P> parent() {
        return parent;
    }

    public P param() {
        return param;
    }

    @Override
    public String name() {
        return parent.name() + " Julia set";
    }

    @Override
    public Complex map(Complex z, P c) {
        return parent.map(z, c);
    }

    @Override
    public Gradient gradient(Complex z, P c) {
        return parent.gradient(z, c);
    }

    @Override
    public Dual mapAndMultiplier(Complex z, P c) {
        return parent.mapAndMultiplier(z, c);
    }

    @Override
    public P paramMap(Complex t) {
        return param;
    }

    @Override
    public Mapped<P> paramMapD(Complex t) {
        return new Mapped<>(param, Complex.ZERO);
    }

    @Override
    public Complex startPoint(Complex t, P c) {
        return t;
    }

    @Override
    public Gradient startPointD(Complex t, P c) {
        return new Gradient(t, Complex.ONE, Complex.ZERO);
    }

    @Override
    public List<Complex> markedPoints(P c) {
        return parent.markedPointsChild(c);
    }

    @Override
    public ParamList<?> metaParams() {
        return new ParamStack<>(parent.metaParams(), param);
    }

    @Override
    public double degreeReal() {
        return parent.degreeReal();
    }

    @Override
    public int escapingPeriod() {
        return parent.escapingPeriod();
    }

    @Override
    public int escapingPhase() {
        return 0;
    }

    @Override
    public Complex escapeCoeff(P c) {
        return parent.escapeCoeff(c);
    }
}
