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

import io.nosqlbench.dynamo.common.grid.PointGrid;
import io.nosqlbench.dynamo.common.math.Dual;
import io.nosqlbench.dynamo.common.params.OrbitParams;
import io.nosqlbench.dynamo.common.params.ParamList;
import io.nosqlbench.dynamo.common.point.PointInfo;
import io.nosqlbench.dynamo.common.symbolic.RationalAngle;
import org.apache.commons.math3.complex.Complex;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A family seen through a reparametrization of its parameter plane.
///
/// Only the parameter map and the point grid change: a selected point `t` becomes the
/// parameter `c(t)`, and every other operation is forwarded to the base family. Covering
/// maps are typically used to uniformize curves such as marked-cycle or Misiurewicz curves,
/// where the natural coordinate is not `c` itself.
///
/// In composed mode the base family's own parameter map runs after the reparametrization,
/// so `t -> base.paramMap(c(t))`.
public class CoveringMap implements FractalFamily<Complex> {

    /// `t -> (c(t), dc/dt)`.
    @FunctionalInterface
    public interface Reparametrization {
        Dual apply(Complex t);
    }

    private final FractalFamily<Complex> base;
    private final Reparametrization cover;
    private final boolean composed;
    private final String label;
    private volatile PointGrid pointGrid;

    public CoveringMap(FractalFamily<Complex> base, String label, Reparametrization cover, PointGrid pointGrid) {
        this(base, label, cover, pointGrid, false);
    }

    public CoveringMap(FractalFamily<Complex> base, String label, Reparametrization cover,
                       PointGrid pointGrid, boolean composed) {
        this.base = Objects.requireNonNull(base, "base cannot be null");
        this.label = Objects.requireNonNull(label, "label cannot be null");
        this.cover = Objects.requireNonNull(cover, "cover cannot be null");
        this.pointGrid = Objects.requireNonNull(pointGrid, "pointGrid cannot be null");
        this.composed = composed;
    }

    public FractalFamily<Complex> base() {
        return base;
    }

    public boolean isComposed() {
        return composed;
    }

    @Override
    public String name() {
        return base.name() + " " + label;
    }

    @Override
    public Complex paramMap(Complex t) {
        Complex c = cover.apply(t).value();
        return composed ? base.paramMap(c) : c;
    }

    @Override
    public Mapped<Complex> paramMapD(Complex t) {
        Dual c = cover.apply(t);
        if (!composed) {
            return new Mapped<>(c.value(), c.deriv());
        }
        Mapped<Complex> inner = base.paramMapD(c.value());
        return new Mapped<>(inner.param(), inner.derivative().multiply(c.deriv()));
    }

    @Override
    public PointGrid pointGrid() {
        return pointGrid;
    }

    @Override
    public void setPointGrid(PointGrid grid) {
        this.pointGrid = Objects.requireNonNull(grid, "grid cannot be null");
    }

    @Override
    public Complex map(Complex z, Complex c) {
        return base.map(z, c);
    }

    @Override
    public Dual mapAndMultiplier(Complex z, Complex c) {
        return base.mapAndMultiplier(z, c);
    }

    @Override
    public Gradient gradient(Complex z, Complex c) {
        return base.gradient(z, c);
    }

    @Override
    public Complex startPoint(Complex t, Complex c) {
        return base.startPoint(t, c);
    }

    @Override
    public Gradient startPointD(Complex t, Complex c) {
        return base.startPointD(t, c);
    }

    @Override
    public OrbitParams orbitParams() {
        return base.orbitParams();
    }

    @Override
    public void setOrbitParams(OrbitParams params) {
        base.setOrbitParams(params);
    }

    @Override
    public Optional<PointInfo> earlyBailout(Complex z0, Complex c) {
        return base.earlyBailout(z0, c);
    }

    @Override
    public ParamList<?> metaParams() {
        return base.metaParams();
    }

    @Override
    public List<Complex> markedPoints(Complex c) {
        return base.markedPoints(c);
    }

    @Override
    public List<Complex> markedPointsChild(Complex c) {
        return base.markedPointsChild(c);
    }

    @Override
    public double markedPointTolerance() {
        return base.markedPointTolerance();
    }

    @Override
    public double degreeReal() {
        return base.degreeReal();
    }

    @Override
    public int escapingPeriod() {
        return base.escapingPeriod();
    }

    @Override
    public int escapingPhase() {
        return base.escapingPhase();
    }

    @Override
    public RationalAngle angleMapLargeParam(RationalAngle angle) {
        return base.angleMapLargeParam(angle);
    }

    @Override
    public Complex escapeCoeff(Complex c) {
        return base.escapeCoeff(c);
    }
}
