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

import org.apache.commons.math3.complex.Complex;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/// Passes a sequence of points through, minus its trailing run of points whose spacing
/// stops shrinking.
///
/// With spacings `s_i = |p_i - p_(i-1)|`, the output ends at the last index `m` with
/// `s_m < s_(m-1)`. The first two points are always kept.
///
/// ```text
///   source:  p0 p1 p2 p3 p4 p5 p6
///   spacing:    9  5  6  2  3  4
///   output:  p0 p1 p2 p3 p4          (p5, p6 only ever grow apart)
/// ```
///
/// Points are released as soon as a later shrinking step vouches for them, so the
/// iterator stays lazy. Only the run since the last shrinking step is held back.
final class TailTrimmingIterator implements Iterator<Complex> {

    private final Iterator<Complex> source;
    private final Deque<Complex> released = new ArrayDeque<>();
    private final Deque<Complex> held = new ArrayDeque<>();

    private Complex previous;
    private double previousSpacing = Double.NaN;
    private int seen;

    TailTrimmingIterator(Iterator<Complex> source) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
    }

    @Override
    public boolean hasNext() {
        while (released.isEmpty() && source.hasNext()) {
            accept(source.next());
        }
        return !released.isEmpty();
    }

    @Override
    public Complex next() {
        if (!hasNext()) {
            throw new NoSuchElementException("sequence is exhausted");
        }
        return released.poll();
    }

    private void accept(Complex point) {
        double spacing = previous == null ? Double.NaN : point.subtract(previous).abs();
        seen++;
        if (seen <= 2) {
            released.add(point);
        } else {
            held.add(point);
            if (spacing < previousSpacing) {
                released.addAll(held);
                held.clear();
            }
        }
        previous = point;
        previousSpacing = spacing;
    }
}
