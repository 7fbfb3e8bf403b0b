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

/// Parent meta-parameters with a local parameter stacked on top.
///
/// @param metaParams the enclosing family's parameters
/// @param localParam the parameter of this level
public record ParamStack<M extends ParamList<?>, P>(M metaParams, P localParam) implements ParamList<P> {

    @Override
    public String toString() {
        return "[" + metaParams + ", " + localParam + "]";
    }
}
