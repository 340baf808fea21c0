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
package com.hellblazer.stipple.packing;

import com.hellblazer.stipple.geometry.Rectangle;

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Bridson style Poisson-disk sampling: no two candidates are closer than {@code spacing}, and new candidates are drawn
 * from the annulus [spacing, 2 * spacing) around an active point until every active point has exhausted its attempts.
 * A background grid of cell {@code spacing / sqrt(2)} holds at most one point per cell, so the minimum distance check
 * only visits the 5x5 cell neighbourhood.
 *
 * @author hal.hildebrand
 */
public class PoissonDiskSampler implements CandidateSampler {

    public static final int    DEFAULT_MAX_ATTEMPTS = 30;
    private static final double SEED_AREA           = 50_000.0;
    private static final int    MAX_SEEDS           = 5;

    private final int maxAttempts;

    public PoissonDiskSampler() {
        this(DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * @param maxAttempts candidates tried around an active point before it is retired
     */
    public PoissonDiskSampler(int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("Max attempts must be positive");
        }
        this.maxAttempts = maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public List<Point2d> sample(Rectangle canvas, double spacing, Random random) {
        if (!(spacing > 0)) {
            throw new IllegalArgumentException("Spacing must be positive");
        }
        var points = new ArrayList<Point2d>();
        if (canvas.isDegenerate()) {
            return points;
        }
        var grid = new BackgroundGrid(canvas, spacing);
        var active = new ArrayList<Point2d>();

        // one seed per 50k square units, capped at 5
        int seeds = (int) Math.min(MAX_SEEDS, Math.max(1, Math.floor(canvas.width() * canvas.height() / SEED_AREA)));
        for (int i = 0; i < seeds; i++) {
            var seed = new Point2d(canvas.x() + random.nextDouble() * canvas.width(),
                                   canvas.y() + random.nextDouble() * canvas.height());
            if (grid.accepts(seed)) {
                grid.add(seed);
                points.add(seed);
                active.add(seed);
            }
        }

        while (!active.isEmpty()) {
            int index = random.nextInt(active.size());
            var origin = active.get(index);
            boolean found = false;
            for (int attempt = 0; attempt < maxAttempts; attempt++) {
                double angle = random.nextDouble() * 2 * Math.PI;
                double distance = spacing + random.nextDouble() * spacing;
                var candidate = new Point2d(origin.x + Math.cos(angle) * distance,
                                            origin.y + Math.sin(angle) * distance);
                if (grid.accepts(candidate)) {
                    grid.add(candidate);
                    points.add(candidate);
                    active.add(candidate);
                    found = true;
                    break;
                }
            }
            if (!found) {
                // swap remove, order of the active list is irrelevant
                active.set(index, active.get(active.size() - 1));
                active.remove(active.size() - 1);
            }
        }
        return points;
    }

    private static class BackgroundGrid {
        private final Rectangle  canvas;
        private final double     spacing;
        private final double     cellSize;
        private final int        columns;
        private final int        rows;
        private final Point2d[]  cells;

        BackgroundGrid(Rectangle canvas, double spacing) {
            this.canvas = canvas;
            this.spacing = spacing;
            this.cellSize = spacing / Math.sqrt(2);
            this.columns = Math.max(1, (int) Math.ceil(canvas.width() / cellSize));
            this.rows = Math.max(1, (int) Math.ceil(canvas.height() / cellSize));
            this.cells = new Point2d[columns * rows];
        }

        boolean accepts(Point2d point) {
            if (point.x < canvas.x() || point.x >= canvas.maxX() || point.y < canvas.y() || point.y >= canvas.maxY()) {
                return false;
            }
            int column = column(point);
            int row = row(point);
            for (int dy = -2; dy <= 2; dy++) {
                for (int dx = -2; dx <= 2; dx++) {
                    int c = column + dx;
                    int r = row + dy;
                    if (c < 0 || c >= columns || r < 0 || r >= rows) {
                        continue;
                    }
                    var neighbor = cells[r * columns + c];
                    if (neighbor != null && neighbor.distance(point) < spacing) {
                        return false;
                    }
                }
            }
            return true;
        }

        void add(Point2d point) {
            cells[row(point) * columns + column(point)] = point;
        }

        private int column(Point2d point) {
            return Math.min(columns - 1, (int) ((point.x - canvas.x()) / cellSize));
        }

        private int row(Point2d point) {
            return Math.min(rows - 1, (int) ((point.y - canvas.y()) / cellSize));
        }
    }
}
