package io.nosqlbench.dynamo.common.point;

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

/// What the cycle detector learned about an orbit that settled onto a cycle.
///
/// @param preperiod iterations before the orbit came within tolerance of the cycle
/// @param period cycle length
/// @param multiplier derivative of the first return map along the cycle
/// @param finalError squared tortoise/hare distance at detection
public record PeriodicInfo(int preperiod, int period, Complex multiplier, double finalError) {
}
