package io.nosqlbench.dynamo.common.newton;

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

/// Outcome of a capped Newton solve.
public sealed interface NewtonResult
    permits NewtonResult.Converged, NewtonResult.FailedToConverge, NewtonResult.NonFinite {

    /// The solve converged.
    ///
    /// @param root the approximate solution
    /// @param value the function value at the last evaluated guess
    /// @param derivative the derivative at the last evaluated guess
    record Converged(Complex root, Complex value, Complex derivative) implements NewtonResult {
    }

    /// The iteration cap was hit with the last step still above the acceptance error.
    record FailedToConverge(Complex lastGuess) implements NewtonResult {
    }

    /// A guess became NaN or infinite.
    record NonFinite() implements NewtonResult {
    }

    default boolean isConverged() {
        return this instanceof Converged;
    }
}
