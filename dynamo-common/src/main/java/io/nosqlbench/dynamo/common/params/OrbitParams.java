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

/// Iteration limits and thresholds for one orbit computation.
///
/// # Usage
///
/// ```java
/// OrbitParams params = OrbitParams.builder()
///     .maxIter(2048)
///     .periodicityTolerance(1e-12)
///     .build();
/// ```
///
/// Instances are immutable, so an orbit never sees its thresholds change midway.
public final class OrbitParams {

    public static final int DEFAULT_MAX_ITER = 1024;
    public static final int DEFAULT_MIN_ITER = 0;
    public static final double DEFAULT_PERIODICITY_TOLERANCE = 1e-14;
    public static final double DEFAULT_ESCAPE_RADIUS = 1e6;

    private final int maxIter;
    private final int minIter;
    private final double periodicityTolerance;
    private final double escapeRadius;

    private OrbitParams(Builder builder) {
        this.maxIter = builder.maxIter;
        this.minIter = builder.minIter;
        this.periodicityTolerance = builder.periodicityTolerance;
        this.escapeRadius = builder.escapeRadius;
    }

    /// Maximum number of tortoise/hare rounds before the orbit is declared bounded.
    public int maxIter() {
        return maxIter;
    }

    /// Number of rounds that must pass before cycles are looked for.
    public int minIter() {
        return minIter;
    }

    /// Squared distance under which the tortoise and hare are considered to coincide.
    /// Zero turns cycle detection off.
    public double periodicityTolerance() {
        return periodicityTolerance;
    }

    /// Orbits whose modulus exceeds this radius have escaped.
    public double escapeRadius() {
        return escapeRadius;
    }

    public static OrbitParams defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxIter(maxIter)
            .minIter(minIter)
            .periodicityTolerance(periodicityTolerance)
            .escapeRadius(escapeRadius);
    }

    @Override
    public String toString() {
        return "OrbitParams{" +
            "maxIter=" + maxIter +
            ", minIter=" + minIter +
            ", periodicityTolerance=" + periodicityTolerance +
            ", escapeRadius=" + escapeRadius +
            '}';
    }

    public static final class Builder {
        private int maxIter = DEFAULT_MAX_ITER;
        private int minIter = DEFAULT_MIN_ITER;
        private double periodicityTolerance = DEFAULT_PERIODICITY_TOLERANCE;
        private double escapeRadius = DEFAULT_ESCAPE_RADIUS;

        Builder() {
        }

        /// @throws IllegalArgumentException if negative
        public Builder maxIter(int maxIter) {
            if (maxIter < 0) {
                throw new IllegalArgumentException("maxIter must be >= 0, got: " + maxIter);
            }
            this.maxIter = maxIter;
            return this;
        }

        /// @throws IllegalArgumentException if negative
        public Builder minIter(int minIter) {
            if (minIter < 0) {
                throw new IllegalArgumentException("minIter must be >= 0, got: " + minIter);
            }
            this.minIter = minIter;
            return this;
        }

        /// @throws IllegalArgumentException if negative or NaN
        public Builder periodicityTolerance(double tolerance) {
            if (!(tolerance >= 0.0)) {
                throw new IllegalArgumentException("periodicity tolerance must be >= 0, got: " + tolerance);
            }
            this.periodicityTolerance = tolerance;
            return this;
        }

        /// @throws IllegalArgumentException if not positive
        public Builder escapeRadius(double radius) {
            if (!(radius > 0.0)) {
                throw new IllegalArgumentException("escape radius must be positive, got: " + radius);
            }
            this.escapeRadius = radius;
            return this;
        }

        public OrbitParams build() {
            return new OrbitParams(this);
        }
    }
}
