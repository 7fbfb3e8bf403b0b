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
import org.apache.commons.math3.complex.Complex;

public sealed interface LocatorResult
    permits LocatorResult.Found, LocatorResult.PeriodIsZero, LocatorResult.NewtonFailed {

    record Found(Complex point) implements LocatorResult {
    }

    /// No point has period zero.
    record PeriodIsZero() implements LocatorResult {
    }

    record NewtonFailed(NewtonResult failure) implements LocatorResult {
    }
}
