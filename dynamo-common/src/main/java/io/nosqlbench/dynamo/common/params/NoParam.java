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

/// The parameter of a family with nothing to vary.
public enum NoParam implements ParamList<NoParam> {
    INSTANCE;

    @Override
    public NoParam localParam() {
        return this;
    }

    @Override
    public String toString() {
        return "";
    }
}
