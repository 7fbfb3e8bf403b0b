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

import org.apache.commons.math3.complex.Complex;

import java.util.Optional;

/// Maps pixel coordinates of a `resX` by `resY` image onto a rectangle of the complex plane.
///
/// Pixel `(0, 0)` is the top-left corner: the real part grows with `x` and the imaginary part
/// shrinks with `y`.
public final class PointGrid {

    private final int resX;
    private final int resY;
    private final Bounds bounds;

    public PointGrid(int resX, int resY, Bounds bounds) {
        if (resX <= 0 || resY <= 0) {
            throw new IllegalArgumentException("resolution must be positive, got: " + resX + "x" + resY);
        }
        this.resX = resX;
        this.resY = resY;
        this.bounds = bounds;
    }

    /// Builds a grid of the given width whose height keeps pixels square.
    public static PointGrid withResX(int resX, Bounds bounds) {
        int resY = (int) Math.round(resX * bounds.rangeY() / bounds.rangeX());
        return new PointGrid(resX, Math.max(1, resY), bounds);
    }

    public int resX() {
        return resX;
    }

    public int resY() {
        return resY;
    }

    public Bounds bounds() {
        return bounds;
    }

    public Complex mapPixel(int x, int y) {
        double re = bounds.minX() + x * bounds.rangeX() / resX;
        double im = bounds.maxY() - y * bounds.rangeY() / resY;
        return new Complex(re, im);
    }

    /// Inverse of [#mapPixel(int, int)], or empty if the point lies outside the bounds.
    public Optional<int[]> locatePoint(Complex z) {
        if (z.getReal() < bounds.minX() || z.getReal() >= bounds.maxX()
            || z.getImaginary() <= bounds.minY() || z.getImaginary() > bounds.maxY()) {
            return Optional.empty();
        }
        int x = (int) ((z.getReal() - bounds.minX()) / bounds.rangeX() * resX);
        int y = (int) ((bounds.maxY() - z.getImaginary()) / bounds.rangeY() * resY);
        return Optional.of(new int[]{Math.min(x, resX - 1), Math.min(y, resY - 1)});
    }

    public double pixelWidth() {
        return bounds.rangeX() / resX;
    }

    public PointGrid withBounds(Bounds newBounds) {
        return new PointGrid(resX, resY, newBounds);
    }

    public PointGrid withResolution(int newResX, int newResY) {
        return new PointGrid(newResX, newResY, bounds);
    }

    @Override
    public String toString() {
        return "PointGrid{" + resX + "x" + resY + ", bounds=" + bounds + '}';
    }
}
