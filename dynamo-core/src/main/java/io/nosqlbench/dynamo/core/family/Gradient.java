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

import org.apache.commons.math3.complex.Complex;

/// A value with its two partial derivatives: along the dynamical variable and along the
/// parameter.
///
/// For a map `f(z, c)` this is `(f, df/dz, df/dc)`. For a start point `z0(t, c)` the first
/// partial is taken along the selection coordinate `t`.
public record Gradient(Complex value, Complex dz, Complex dc) {

    /// Total derivative along `t` given how the variable and parameter move with it.
    ///
    /// @param dzdt derivative of the variable
    /// @param dcdt derivative of the parameter
    /// @return `dz * dzdt + dc * dcdt`
    public Complex chain(Complex dzdt, Complex dcdt) {
        return dz.multiply(dzdt).add(dc.multiply(dcdt));
    }
}
