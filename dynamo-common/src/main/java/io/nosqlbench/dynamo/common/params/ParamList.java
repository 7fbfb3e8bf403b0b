package io.nosqlbench.dynamo.common.params;

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

/// A parameter bundle that projects onto the local parameter a family iterates with.
///
/// Plain families use their parameter directly. A child family stacks its parent's
/// parameters beneath its own with [ParamStack].
///
/// @param <P> the local parameter type
public interface ParamList<P> {

    P localParam();

    static <P> ParamList<P> of(P param) {
        return new Single<>(param);
    }

    record Single<P>(P localParam) implements ParamList<P> {
    }
}
