package io.nosqlbench.dynamo.common.symbolic;

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

/// Combinatorial type of a preperiodic point: it lands on a cycle of length `period` after
/// `preperiod` steps.
///
/// @param preperiod number of steps before the orbit enters the cycle
/// @param period length of the cycle; zero is representable but has no points
public record OrbitSchema(int preperiod, int period) {

    public OrbitSchema {
        if (preperiod < 0 || period < 0) {
            throw new IllegalArgumentException(
                "preperiod and period must be non-negative, got: (" + preperiod + ", " + period + ")");
        }
    }

    @Override
    public String toString() {
        return "(" + preperiod + ", " + period + ")";
    }
}
