/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Stipple.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.stipple.index.benchmark;

import com.hellblazer.stipple.geometry.Circle;
import com.hellblazer.stipple.geometry.Rectangle;
import com.hellblazer.stipple.index.CircleIndex;
import com.hellblazer.stipple.index.CircleQuadTree;
import com.hellblazer.stipple.index.SpatialHashGrid;
import org.junit.jupiter.api.Disabled;
import org.junit.jupiter.api.Tag;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Cost of the collision-free radius query against a populated canvas, for both indexes and for a linear scan over all
 * circles
 *
 * @author hal.hildebrand
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 3, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
@State(Scope.Benchmark)
@Disabled("JMH benchmark - run manually")
@Tag("benchmark")
public class MaxRadiusBenchmark {

    private static final double CANVAS  = 2000;
    private static final int    QUERIES = 256;

    @Param({ "1000", "10000", "50000" })
    private int circleCount;

    private CircleQuadTree  quadTree;
    private SpatialHashGrid hashGrid;
    private List<Circle>    circles;
    private double[]        queryX;
    private double[]        queryY;
    private int             next;

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder().include(MaxRadiusBenchmark.class.getSimpleName()).forks(1).build();

        new Runner(opt).run();
    }

    @Benchmark
    public double hashGrid() {
        return query(hashGrid);
    }

    @Benchmark
    public double linearScan() {
        int i = next++ & (QUERIES - 1);
        double x = queryX[i];
        double y = queryY[i];
        double bound = Math.min(Math.min(x, y), Math.min(CANVAS - x, CANVAS - y)) * CircleIndex.EDGE_SAFETY_FACTOR;
        for (var circle : circles) {
            bound = Math.min(bound, (circle.distanceTo(x, y) - circle.radius() - 1) * CircleIndex.CIRCLE_SAFETY_FACTOR);
        }
        return Math.max(0, bound);
    }

    @Benchmark
    public double quadTree() {
        return query(quadTree);
    }

    @Setup(Level.Trial)
    public void setup() {
        var random = new Random(42);
        var boundary = new Rectangle(0, 0, CANVAS, CANVAS);
        quadTree = new CircleQuadTree(boundary, 15);
        hashGrid = SpatialHashGrid.forAverageRadius(boundary, 3);
        circles = new ArrayList<>(circleCount);
        for (int i = 0; i < circleCount; i++) {
            var circle = new Circle(random.nextDouble() * CANVAS, random.nextDouble() * CANVAS,
                                    0.5 + random.nextDouble() * 5);
            quadTree.insert(circle);
            hashGrid.insert(circle);
            circles.add(circle);
        }
        queryX = new double[QUERIES];
        queryY = new double[QUERIES];
        for (int i = 0; i < QUERIES; i++) {
            queryX[i] = random.nextDouble() * CANVAS;
            queryY[i] = random.nextDouble() * CANVAS;
        }
    }

    private double query(CircleIndex index) {
        int i = next++ & (QUERIES - 1);
        return index.getMaxRadiusWithoutCollision(queryX[i], queryY[i], CANVAS, CANVAS, 1);
    }
}
