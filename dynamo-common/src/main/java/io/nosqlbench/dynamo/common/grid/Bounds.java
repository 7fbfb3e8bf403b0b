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

/// Axis-aligned rectangle of the complex plane.
public record Bounds(double minX, double maxX, double minY, double maxY) {

    public static Bounds centered(Complex center, double halfWidth, double halfHeight) {
        return new Bounds(
            center.getReal() - halfWidth, center.getReal() + halfWidth,
            center.getImaginary() - halfHeight, center.getImaginary() + halfHeight);
    }

    public double rangeX() {
        return maxX - minX;
    }

    public double rangeY() {
        return maxY - minY;
    }

    public double area() {
        return rangeX() * rangeY();
    }

    public Complex center() {
        return new Complex(0.5 * (minX + maxX), 0.5 * (minY + maxY));
    }

    /// A degenerate rectangle, which a plane computation skips entirely.
    public boolean isNaN() {
        return Double.isNaN(minX) || Double.isNaN(maxX) || Double.isNaN(minY) || Double.isNaN(maxY);
    }
}
