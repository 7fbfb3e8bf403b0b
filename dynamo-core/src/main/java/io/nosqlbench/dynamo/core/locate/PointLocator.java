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

import io.nosqlbench.dynamo.common.math.Dual;
import io.nosqlbench.dynamo.common.math.NumberTheory;
import io.nosqlbench.dynamo.common.newton.Newton;
import io.nosqlbench.dynamo.common.newton.NewtonResult;
import io.nosqlbench.dynamo.common.symbolic.OrbitSchema;
import io.nosqlbench.dynamo.core.family.DynamicalFamily;
import org.apache.commons.math3.complex.Complex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Finds points with a prescribed preperiod and exact period by Newton's method.
///
/// For a schema `(k, n)` the solved function of the selected coordinate `t` is
///
/// ```text
///   prod over m | n, mu(n/m) != 0 of ( f^(m+k)(t) - f^k(t) ) ^ mu(n/m)
/// ```
///
/// which vanishes at period-`n` points but not at points of any proper divisor period.
/// When `k > 0` it is further divided by `f^(k+n-1)(t) - f^(k-1)(t)`, removing the points
/// whose preperiod is smaller than `k`.
public final class PointLocator {

    private static final Logger logger = LogManager.getLogger(PointLocator.class);

    private PointLocator() {
    }

    public static <P> LocatorResult find(DynamicalFamily<P> family, Complex start, OrbitSchema schema) {
        int n = schema.period();
        int k = schema.preperiod();
        if (n == 0) {
            return new LocatorResult.PeriodIsZero();
        }
        int[] divisors = NumberTheory.divisors(n);
        int[] exponents = new int[divisors.length];
        for (int i = 0; i < divisors.length; i++) {
            exponents[i] = NumberTheory.moebius(n / divisors[i]);
        }

        NewtonResult result = Newton.findRoot(t -> exactPeriodFunction(family, t, k, n, divisors, exponents), start);
        if (result instanceof NewtonResult.Converged converged) {
            Complex point = converged.root();
            logger.debug("Located {} point {} from seed {}", schema, point, start);
            return new LocatorResult.Found(point);
        }
        logger.debug("Newton failed locating {} point from seed {}: {}", schema, start, result);
        return new LocatorResult.NewtonFailed(result);
    }

    static <P> Dual exactPeriodFunction(DynamicalFamily<P> family, Complex t, int k, int n,
                                        int[] divisors, int[] exponents) {
        Dual[] orbit = family.orbitD(t, k + n);
        Dual product = Dual.one();
        for (int i = 0; i < divisors.length; i++) {
            int mu = exponents[i];
            if (mu == 0) {
                continue;
            }
            Dual term = orbit[divisors[i] + k].minus(orbit[k]);
            product = mu > 0 ? product.times(term) : product.divide(term);
        }
        if (k > 0) {
            product = product.divide(orbit[k + n - 1].minus(orbit[k - 1]));
        }
        return product;
    }
}
