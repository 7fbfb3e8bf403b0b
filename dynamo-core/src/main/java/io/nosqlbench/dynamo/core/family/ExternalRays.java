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

import io.nosqlbench.dynamo.common.symbolic.RationalAngle;
import io.nosqlbench.dynamo.core.trace.RayTracer;
import io.nosqlbench.dynamo.core.trace.TracerOptions;
import org.apache.commons.math3.complex.Complex;

import java.util.Iterator;
import java.util.Optional;

public interface ExternalRays<P> extends DynamicalFamily<P>, InfinityFirstReturnMap<P> {

    /// The external ray at `angle`, from far outside towards the boundary. Empty when the
    /// family has no finite degree at infinity.
    default Optional<Iterator<Complex>> externalRay(RationalAngle angle) {
        return new RayTracer<>(this, TracerOptions.defaults()).trace(angle);
    }
}
