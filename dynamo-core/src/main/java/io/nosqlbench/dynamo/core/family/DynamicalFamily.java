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
import io.nosqlbench.dynamo.common.params.NoParam;
import io.nosqlbench.dynamo.common.params.OrbitParams;
import io.nosqlbench.dynamo.common.params.ParamList;
import io.nosqlbench.dynamo.common.point.PointInfo;
import org.apache.commons.math3.complex.Complex;

import java.util.Optional;

/// A parametrized family of holomorphic maps `z -> f(z, c)` on the complex line.
///
/// A plane is explored by mapping each selected point `t` to a parameter with
/// [#paramMap(Complex)] and a start point with [#startPoint(Complex, Object)], then
/// iterating [#map(Complex, Object)].
///
/// Implementations must be safe to call from several threads at once as long as no setter
/// runs concurrently; plane computations read the family from every worker.
///
/// @param <P> the parameter type
public interface DynamicalFamily<P> {

    String name();

    Complex map(Complex z, P c);

    /// The map with its derivative along `z`.
    default Dual mapAndMultiplier(Complex z, P c) {
        Gradient g = gradient(z, c);
        return new Dual(g.value(), g.dz());
    }

    /// The map with both partial derivatives.
    Gradient gradient(Complex z, P c);

    P paramMap(Complex t);

    Mapped<P> paramMapD(Complex t);

    Complex startPoint(Complex t, P c);

    /// The start point with its partials along the selection and along the parameter.
    Gradient startPointD(Complex t, P c);

    /// The orbit of the selected point `t` with derivatives along `t`.
    ///
    /// Entry `j` holds `(f^j(z0), d f^j(z0) / dt)`, where both the start point and the
    /// parameter move with `t`.
    ///
    /// @param steps number of map applications
    /// @return `steps + 1` values, starting with the start point
    default Dual[] orbitD(Complex t, int steps) {
        Mapped<P> mapped = paramMapD(t);
        P c = mapped.param();
        Complex dcdt = mapped.derivative();
        Gradient z0 = startPointD(t, c);

        Dual[] orbit = new Dual[steps + 1];
        Complex z = z0.value();
        Complex dzdt = z0.chain(Complex.ONE, dcdt);
        orbit[0] = new Dual(z, dzdt);
        for (int j = 1; j <= steps; j++) {
            Gradient g = gradient(z, c);
            dzdt = g.chain(dzdt, dcdt);
            z = g.value();
            orbit[j] = new Dual(z, dzdt);
        }
        return orbit;
    }

    /// The last entry of [#orbitD(Complex, int)].
    default Dual iterateD(Complex t, int steps) {
        return orbitD(t, steps)[steps];
    }

    OrbitParams orbitParams();

    void setOrbitParams(OrbitParams params);

    PointGrid pointGrid();

    void setPointGrid(PointGrid grid);

    /// Result known in closed form for this start point and parameter, if any. Consulted
    /// before the first iteration.
    default Optional<PointInfo> earlyBailout(Complex z0, P c) {
        return Optional.empty();
    }

    /// The full parameter bundle of this family, for display and for child families.
    default ParamList<?> metaParams() {
        return NoParam.INSTANCE;
    }

    default double escapeRadius() {
        return orbitParams().escapeRadius();
    }

    default double periodicityTolerance() {
        return orbitParams().periodicityTolerance();
    }

    default int minIter() {
        return orbitParams().minIter();
    }

    default int maxIter() {
        return orbitParams().maxIter();
    }
}
