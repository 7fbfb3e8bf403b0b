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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class OrbitParamsTest {

    @Test
    public void defaults() {
        OrbitParams params = OrbitParams.defaults();
        assertThat(params.maxIter()).isEqualTo(OrbitParams.DEFAULT_MAX_ITER);
        assertThat(params.minIter()).isZero();
        assertThat(params.escapeRadius()).isEqualTo(1e6);
    }

    @Test
    public void toBuilderCopiesEveryField() {
        OrbitParams params = OrbitParams.builder()
            .maxIter(50)
            .minIter(5)
            .periodicityTolerance(1e-10)
            .escapeRadius(100.0)
            .build();
        OrbitParams copy = params.toBuilder().maxIter(60).build();
        assertThat(copy.maxIter()).isEqualTo(60);
        assertThat(copy.minIter()).isEqualTo(5);
        assertThat(copy.periodicityTolerance()).isEqualTo(1e-10);
        assertThat(copy.escapeRadius()).isEqualTo(100.0);
    }

    @Test
    public void rejectsInvalidValues() {
        assertThatThrownBy(() -> OrbitParams.builder().maxIter(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OrbitParams.builder().periodicityTolerance(Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OrbitParams.builder().escapeRadius(0.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void paramStackProjectsToLocal() {
        ParamStack<ParamList<Integer>, String> stack = new ParamStack<>(ParamList.of(3), "c");
        assertThat(stack.localParam()).isEqualTo("c");
        assertThat(stack.metaParams().localParam()).isEqualTo(3);
        assertThat(NoParam.INSTANCE.localParam()).isSameAs(NoParam.INSTANCE);
    }
}
