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

import io.nosqlbench.dynamo.common.math.Complexes;
import io.nosqlbench.dynamo.common.math.Dual;
import org.apache.commons.math3.complex.Complex;

import java.util.function.Function;

/// Capped Newton iteration over the complex line.
///
/// Every solver here evaluates a function together with its derivative, given as a
/// [Dual], and steps `guess -= (f(guess) - target) / f'(guess)`.
///
/// Termination:
/// - the squared step falls below [#MIN_ERR]: converged
/// - a guess is NaN or infinite: [NewtonResult.NonFinite]
/// - [#MAX_ITERS] steps elapse: converged if the last squared step is below the acceptance
///   error ([#MAX_ERR] unless given), otherwise [NewtonResult.FailedToConverge]
public final class Newton {

    public static final int MAX_ITERS = 16;
    public static final double MIN_ERR = 1e-12;
    public static final double MAX_ERR = 1e-5;

    private Newton() {
    }

    public static NewtonResult findRoot(Function<Complex, Dual> fn, Complex start) {
        return findTarget(fn, start, Complex.ZERO, MAX_ERR, MAX_ITERS);
    }

    public static NewtonResult findTarget(Function<Complex, Dual> fn, Complex start, Complex target) {
        return findTarget(fn, start, target, MAX_ERR, MAX_ITERS);
    }

    /// Solves `fn(z) = target` starting from `start`.
    ///
    /// @param acceptError squared step under which a guess is accepted when the cap is hit
    /// @param maxIterations iteration cap
    public static NewtonResult findTarget(
        Function<Complex, Dual> fn,
        Complex start,
        Complex target,
        double acceptError,
        int maxIterations
    ) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive, got: " + maxIterations);
        }
        Complex guess = start;
        Dual eval = null;
        double stepSqr = Double.POSITIVE_INFINITY;
        for (int i = 0; i < maxIterations; i++) {
            eval = fn.apply(guess);
            Complex step = eval.value().subtract(target).divide(eval.deriv());
            Complex next = guess.subtract(step);
            if (!Complexes.isFinite(next)) {
                return new NewtonResult.NonFinite();
            }
            stepSqr = Complexes.normSqr(step);
            guess = next;
            if (stepSqr < MIN_ERR) {
                return new NewtonResult.Converged(guess, eval.value(), eval.deriv());
            }
        }
        if (stepSqr < acceptError) {
            return new NewtonResult.Converged(guess, eval.value(), eval.deriv());
        }
        return new NewtonResult.FailedToConverge(guess);
    }

    /// Solves `fn(z) = target` measuring convergence relative to the target, as
    /// `|f(z) / target - 1|^2`. Suited to targets of very large modulus, such as points on
    /// an equipotential far out in the escaping region.
    public static NewtonResult findTargetRelative(Function<Complex, Dual> fn, Complex start, Complex target) {
        Complex guess = start;
        Dual eval = null;
        double relErr = Double.POSITIVE_INFINITY;
        for (int i = 0; i < MAX_ITERS; i++) {
            eval = fn.apply(guess);
            relErr = Complexes.normSqr(eval.value().divide(target).subtract(Complex.ONE));
            if (relErr < MIN_ERR) {
                return new NewtonResult.Converged(guess, eval.value(), eval.deriv());
            }
            Complex next = guess.subtract(eval.value().subtract(target).divide(eval.deriv()));
            if (!Complexes.isFinite(next)) {
                return new NewtonResult.NonFinite();
            }
            guess = next;
        }
        if (relErr < MAX_ERR) {
            return new NewtonResult.Converged(guess, eval.value(), eval.deriv());
        }
        return new NewtonResult.FailedToConverge(guess);
    }
}
