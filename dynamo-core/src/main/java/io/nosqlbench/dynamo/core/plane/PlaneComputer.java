package io.nosqlbench.dynamo.core.plane;

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

import io.nosqlbench.dynamo.common.grid.IterPlane;
import io.nosqlbench.dynamo.common.grid.PointGrid;
import io.nosqlbench.dynamo.core.classify.EscapeClassifier;
import io.nosqlbench.dynamo.core.classify.InteriorClassifier;
import io.nosqlbench.dynamo.core.family.Computable;
import io.nosqlbench.dynamo.core.orbit.ComputeMode;
import io.nosqlbench.dynamo.core.orbit.EscapeResult;
import io.nosqlbench.dynamo.core.orbit.OrbitEngine;
import org.apache.commons.math3.complex.Complex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

/// Classifies every pixel of an [IterPlane] in parallel.
///
/// ## Tiling
///
/// ```text
///   rows 0 .. h-1 split into contiguous chunks of max(1, h / parallelism) rows
///
///   ┌───────────────────────┐
///   │ chunk 0  (worker A)   │
///   ├───────────────────────┤
///   │ chunk 1  (worker B)   │
///   ├───────────────────────┤
///   │ ...                   │
///   └───────────────────────┘
/// ```
///
/// Each worker thread keeps one [OrbitEngine] for the duration of a call and resets it per
/// pixel. Chunks write disjoint rows, and all tasks are joined before
/// [#computeInto(Computable, IterPlane)] returns, so the caller sees every write.
///
/// In [ComputeMode#DISTANCE_ESTIMATION] the engines carry derivatives and escaping pixels
/// hold distance estimates instead of potentials.
///
/// Results are deterministic: the same family state and plane always produce the same
/// contents.
public final class PlaneComputer implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(PlaneComputer.class);

    private final ForkJoinPool pool;
    private final boolean ownsPool;

    /// A computer with one worker per available processor.
    public PlaneComputer() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public PlaneComputer(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive, got: " + parallelism);
        }
        this.pool = new ForkJoinPool(parallelism);
        this.ownsPool = true;
    }

    /// Runs on a caller-managed pool, which [#close()] leaves alone.
    public PlaneComputer(ForkJoinPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool cannot be null");
        this.ownsPool = false;
    }

    public int parallelism() {
        return pool.getParallelism();
    }

    public <P> void computeInto(Computable<P> family, IterPlane plane) {
        computeInto(family, plane, InteriorClassifier.PERIODIC, ComputeMode.SMOOTH_POTENTIAL);
    }

    public <P> void computeInto(Computable<P> family, IterPlane plane, ComputeMode mode) {
        computeInto(family, plane, InteriorClassifier.PERIODIC, mode);
    }

    public <P> void computeInto(Computable<P> family, IterPlane plane, InteriorClassifier interior) {
        computeInto(family, plane, interior, ComputeMode.SMOOTH_POTENTIAL);
    }

    /// Fills `plane` with the classification of each of its pixels.
    ///
    /// @throws IllegalStateException if a worker fails
    public <P> void computeInto(Computable<P> family, IterPlane plane, InteriorClassifier interior,
                                ComputeMode mode) {
        Objects.requireNonNull(mode, "mode cannot be null");
        PointGrid grid = plane.grid();
        if (grid.bounds().isNaN()) {
            logger.debug("Skipping plane with NaN bounds for {}", family.name());
            return;
        }

        long startNanos = System.nanoTime();
        EscapeClassifier<P> classifier = new EscapeClassifier<>(family, interior);
        ThreadLocal<OrbitEngine<P>> engines = ThreadLocal.withInitial(
            () -> new OrbitEngine<>(family, false, mode.tracksDerivative()));

        int rows = grid.resY();
        int chunk = Math.max(1, rows / pool.getParallelism());
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int first = 0; first < rows; first += chunk) {
            int from = first;
            int to = Math.min(rows, first + chunk);
            tasks.add(() -> {
                OrbitEngine<P> engine = engines.get();
                for (int y = from; y < to; y++) {
                    for (int x = 0; x < grid.resX(); x++) {
                        Complex t = grid.mapPixel(x, y);
                        engine.reset(t);
                        EscapeResult result = engine.runUntilComplete();
                        plane.set(x, y, classifier.classify(engine, result, mode));
                    }
                }
                return null;
            });
        }

        List<Future<Void>> futures = pool.invokeAll(tasks);
        for (Future<Void> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                throw new IllegalStateException("Plane computation failed for " + family.name(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while computing plane for " + family.name(), e);
            }
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Computed {}x{} {} plane for {} in {} tasks ({} ms)",
                grid.resX(), rows, mode, family.name(), tasks.size(), (System.nanoTime() - startNanos) / 1_000_000);
        }
    }

    @Override
    public void close() {
        if (ownsPool) {
            pool.shutdown();
        }
    }
}
