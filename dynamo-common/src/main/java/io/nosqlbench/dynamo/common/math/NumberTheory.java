package io.nosqlbench.dynamo.common.math;

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

import org.apache.commons.math3.util.ArithmeticUtils;

import java.util.ArrayList;
import java.util.List;

/// Divisors and the Möbius function, as used to cancel lower-period roots when
/// locating points of exact period.
public final class NumberTheory {

    private NumberTheory() {
    }

    /// All positive divisors of `n`, in ascending order.
    ///
    /// @throws IllegalArgumentException if `n` is not positive
    public static int[] divisors(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("divisors are only defined for positive integers, got: " + n);
        }
        List<Integer> low = new ArrayList<>();
        List<Integer> high = new ArrayList<>();
        for (int k = 1; (long) k * k <= n; k++) {
            if (n % k == 0) {
                low.add(k);
                if (k != n / k) {
                    high.add(n / k);
                }
            }
        }
        int[] result = new int[low.size() + high.size()];
        int i = 0;
        for (int d : low) {
            result[i++] = d;
        }
        for (int j = high.size() - 1; j >= 0; j--) {
            result[i++] = high.get(j);
        }
        return result;
    }

    /// The Möbius function: `0` if `n` has a squared prime factor, otherwise `(-1)^k` for
    /// `k` distinct prime factors.
    public static int moebius(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("moebius is only defined for positive integers, got: " + n);
        }
        int m = n;
        int sign = 1;
        for (int p = 2; (long) p * p <= m; p++) {
            if (m % p == 0) {
                m /= p;
                if (m % p == 0) {
                    return 0;
                }
                sign = -sign;
            }
        }
        if (m > 1) {
            sign = -sign;
        }
        return sign;
    }

    public static long gcd(long a, long b) {
        return ArithmeticUtils.gcd(a, b);
    }
}
