package io.nosqlbench.dynamo.core.trace;

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

/// Settings for the external ray and equipotential tracers.
///
/// ```java
/// TracerOptions options = TracerOptions.builder().depth(100).sharpness(40).build();
/// ```
public final class TracerOptions {

    public static final int DEFAULT_DEPTH = 200;
    public static final int DEFAULT_SHARPNESS = 25;
    public static final double DEFAULT_SEED_RADIUS = 65.0;
    public static final double DEFAULT_RAY_ESCAPE_RADIUS = 16.0;
    public static final double DEFAULT_EQUIPOTENTIAL_ESCAPE_RADIUS_SQR = 30.0;
    public static final int DEFAULT_EQUIPOTENTIAL_MAX_ITER = 13;
    public static final double DEFAULT_TURNS_PER_STEP = 0.02;

    private final int depth;
    private final int sharpness;
    private final double seedRadius;
    private final double rayEscapeRadius;
    private final double equipotentialEscapeRadiusSqr;
    private final int equipotentialMaxIter;
    private final double turnsPerStep;

    private TracerOptions(Builder builder) {
        this.depth = builder.depth;
        this.sharpness = builder.sharpness;
        this.seedRadius = builder.seedRadius;
        this.rayEscapeRadius = builder.rayEscapeRadius;
        this.equipotentialEscapeRadiusSqr = builder.equipotentialEscapeRadiusSqr;
        this.equipotentialMaxIter = builder.equipotentialMaxIter;
        this.turnsPerStep = builder.turnsPerStep;
    }

    /// Number of rounds; round `k` solves with `k * period + phase` iterations.
    public int depth() {
        return depth;
    }

    /// Newton continuation steps per round.
    public int sharpness() {
        return sharpness;
    }

    /// Modulus of the first Newton seed.
    public double seedRadius() {
        return seedRadius;
    }

    public double rayEscapeRadius() {
        return rayEscapeRadius;
    }

    public double equipotentialEscapeRadiusSqr() {
        return equipotentialEscapeRadiusSqr;
    }

    public int equipotentialMaxIter() {
        return equipotentialMaxIter;
    }

    /// Rotation of the equipotential target per step, in turns.
    public double turnsPerStep() {
        return turnsPerStep;
    }

    public static TracerOptions defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "TracerOptions{" +
            "depth=" + depth +
            ", sharpness=" + sharpness +
            ", seedRadius=" + seedRadius +
            ", rayEscapeRadius=" + rayEscapeRadius +
            ", equipotentialEscapeRadiusSqr=" + equipotentialEscapeRadiusSqr +
            ", equipotentialMaxIter=" + equipotentialMaxIter +
            ", turnsPerStep=" + turnsPerStep +
            '}';
    }

    public static final class Builder {
        private int depth = DEFAULT_DEPTH;
        private int sharpness = DEFAULT_SHARPNESS;
        private double seedRadius = DEFAULT_SEED_RADIUS;
        private double rayEscapeRadius = DEFAULT_RAY_ESCAPE_RADIUS;
        private double equipotentialEscapeRadiusSqr = DEFAULT_EQUIPOTENTIAL_ESCAPE_RADIUS_SQR;
        private int equipotentialMaxIter = DEFAULT_EQUIPOTENTIAL_MAX_ITER;
        private double turnsPerStep = DEFAULT_TURNS_PER_STEP;

        Builder() {
        }

        public Builder depth(int depth) {
            if (depth <= 0) {
                throw new IllegalArgumentException("depth must be positive, got: " + depth);
            }
            this.depth = depth;
            return this;
        }

        public Builder sharpness(int sharpness) {
            if (sharpness <= 0) {
                throw new IllegalArgumentException("sharpness must be positive, got: " + sharpness);
            }
            this.sharpness = sharpness;
            return this;
        }

        public Builder seedRadius(double seedRadius) {
            this.seedRadius = seedRadius;
            return this;
        }

        public Builder rayEscapeRadius(double radius) {
            if (!(radius > 1.0)) {
                throw new IllegalArgumentException("ray escape radius must exceed 1, got: " + radius);
            }
            this.rayEscapeRadius = radius;
            return this;
        }

        public Builder equipotentialEscapeRadiusSqr(double radiusSqr) {
            this.equipotentialEscapeRadiusSqr = radiusSqr;
            return this;
        }

        public Builder equipotentialMaxIter(int maxIter) {
            if (maxIter <= 0) {
                throw new IllegalArgumentException("equipotential max iterations must be positive, got: " + maxIter);
            }
            this.equipotentialMaxIter = maxIter;
            return this;
        }

        public Builder turnsPerStep(double turns) {
            if (!(turns > 0.0)) {
                throw new IllegalArgumentException("turns per step must be positive, got: " + turns);
            }
            this.turnsPerStep = turns;
            return this;
        }

        public TracerOptions build() {
            return new TracerOptions(this);
        }
    }
}
