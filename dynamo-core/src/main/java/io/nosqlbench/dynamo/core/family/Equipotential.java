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

import io.nosqlbench.dynamo.core.trace.EquipotentialTracer;
import io.nosqlbench.dynamo.core.trace.TracerOptions;
import org.apache.commons.math3.complex.Complex;

import java.util.List;
import java.util.Optional;

public interface Equipotential<P> extends DynamicalFamily<P>, InfinityFirstReturnMap<P> {

    /// The level curve of the potential through `t0`, starting with `t0`. Empty when `t0`
    /// does not escape quickly enough to seed the curve.
    default Optional<List<Complex>> equipotential(Complex t0) {
        return new EquipotentialTracer<>(this, TracerOptions.defaults()).trace(t0);
    }
}
