package io.nosqlbench.dynamo.core.orbit;

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

import io.nosqlbench.dynamo.common.point.PointInfo;
import org.apache.commons.math3.complex.Complex;

import java.util.List;

/// A single orbit with the values it visited and its classification.
///
/// @param param parameter the orbit ran with
/// @param start start point
/// @param orbit successive values of the fast orbit, starting with `start`
/// @param info classification of the orbit
public record OrbitAndInfo<P>(P param, Complex start, List<Complex> orbit, PointInfo info) {
}
