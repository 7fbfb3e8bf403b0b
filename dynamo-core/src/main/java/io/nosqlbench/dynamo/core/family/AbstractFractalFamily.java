package io.nosqlbench.dynamo.core.family;

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

import io.nosqlbench.dynamo.common.grid.PointGrid;
import io.nosqlbench.dynamo.common.params.OrbitParams;

import java.util.Objects;

/// Holds the mutable view state shared by every concrete family: the point grid and the
/// orbit parameters.
public abstract class AbstractFractalFamily<P> implements FractalFamily<P> {

    /// Scale of the default periodicity tolerance relative to the grid area.
    public static final double TOLERANCE_PER_AREA = 1e-14;

    private volatile PointGrid pointGrid;
    private volatile OrbitParams orbitParams;

    protected AbstractFractalFamily(PointGrid pointGrid) {
        this(pointGrid, defaultOrbitParams(pointGrid));
    }

    protected AbstractFractalFamily(PointGrid pointGrid, OrbitParams orbitParams) {
        this.pointGrid = Objects.requireNonNull(pointGrid, "pointGrid cannot be null");
        this.orbitParams = Objects.requireNonNull(orbitParams, "orbitParams cannot be null");
    }

    /// Default parameters with a periodicity tolerance scaled to the grid's area.
    public static OrbitParams defaultOrbitParams(PointGrid grid) {
        return OrbitParams.builder()
            .periodicityTolerance(grid.bounds().area() * TOLERANCE_PER_AREA)
            .build();
    }

    @Override
    public PointGrid pointGrid() {
        return pointGrid;
    }

    @Override
    public void setPointGrid(PointGrid grid) {
        this.pointGrid = Objects.requireNonNull(grid, "grid cannot be null");
    }

    @Override
    public OrbitParams orbitParams() {
        return orbitParams;
    }

    @Override
    public void setOrbitParams(OrbitParams params) {
        this.orbitParams = Objects.requireNonNull(params, "params cannot be null");
    }

    @Override
    public String toString() {
        return name() + "{" + pointGrid + ", " + orbitParams + "}";
    }
}
