package io.nosqlbench.dynamo.common.grid;

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

import java.util.Arrays;
import java.util.Objects;

/// Row-major buffer of [PointInfo] results covering a [PointGrid].
///
/// The plane is owned by the caller. A plane computation writes each row from exactly one
/// worker, so no synchronization happens at this level.
public final class IterPlane {

    private final PointGrid grid;
    private final PointInfo[] data;

    public IterPlane(PointGrid grid) {
        this.grid = Objects.requireNonNull(grid, "grid cannot be null");
        this.data = new PointInfo[Math.multiplyExact(grid.resX(), grid.resY())];
        Arrays.fill(data, PointInfo.bounded());
    }

    public PointGrid grid() {
        return grid;
    }

    public int width() {
        return grid.resX();
    }

    public int height() {
        return grid.resY();
    }

    public PointInfo get(int x, int y) {
        return data[index(x, y)];
    }

    public void set(int x, int y, PointInfo info) {
        data[index(x, y)] = Objects.requireNonNull(info);
    }

    public void fill(PointInfo info) {
        Arrays.fill(data, Objects.requireNonNull(info));
    }

    /// A copy of the row-major contents.
    public PointInfo[] snapshot() {
        return data.clone();
    }

    private int index(int x, int y) {
        if (x < 0 || x >= grid.resX() || y < 0 || y >= grid.resY()) {
            throw new IndexOutOfBoundsException("pixel (" + x + ", " + y + ") outside " + grid.resX() + "x" + grid.resY());
        }
        return y * grid.resX() + x;
    }
}
