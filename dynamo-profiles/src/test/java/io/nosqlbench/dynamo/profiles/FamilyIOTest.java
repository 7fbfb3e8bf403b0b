package io.nosqlbench.dynamo.profiles;

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

import io.nosqlbench.dynamo.core.family.FamilyIO;
import io.nosqlbench.dynamo.core.family.FractalFamily;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class FamilyIOTest {

    @Test
    public void registeredFamiliesAreDiscovered() {
        assertThat(FamilyIO.getAvailableNames()).contains("mandelbrot", "unicritical", "newton-cubic");
        assertThat(FamilyIO.getAll()).hasSizeGreaterThanOrEqualTo(3);
    }

    @Test
    public void createReturnsFreshInstances() {
        FractalFamily<?> first = FamilyIO.create("mandelbrot");
        FractalFamily<?> second = FamilyIO.create("mandelbrot");
        assertThat(first).isInstanceOf(Mandelbrot.class);
        assertThat(first).isNotSameAs(second);
        assertThat(FamilyIO.create("newton-cubic")).isInstanceOf(NewtonCubic.class);
    }

    @Test
    public void unknownNameIsRejected() {
        assertThat(FamilyIO.get("burning-ship")).isEmpty();
        assertThatThrownBy(() -> FamilyIO.create("burning-ship"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("burning-ship")
            .hasMessageContaining("mandelbrot");
    }
}
