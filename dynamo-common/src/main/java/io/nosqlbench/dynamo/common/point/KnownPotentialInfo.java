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

/// Cycle data computed analytically rather than by iteration.
///
/// @param period cycle length
/// @param multiplier cycle multiplier
/// @param potential interior potential derived from the multiplier
public record KnownPotentialInfo(int period, Complex multiplier, double potential) {
}
