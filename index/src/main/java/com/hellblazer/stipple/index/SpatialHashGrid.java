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
package com.hellblazer.stipple.index;

import com.hellblazer.stipple.geometry.Circle;
import com.hellblazer.stipple.geometry.Rectangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Uniform grid of square cells over the boundary. A circle is registered in every cell its bounding square overlaps,
 * clamped into the grid, and queries report each insertion once. Works best when circle radii are of the same order as
 * the cell size; see {@link #forAverageRadius(Rectangle, double)}.
 * <p>
 * Thread Safety: This class is NOT thread-safe.
 *
 * @author hal.hildebrand
 */
public class SpatialHashGrid extends AbstractCircleIndex {

    public static final double CELL_SIZE_RADIUS_FACTOR = 2.5;
    public static final double MIN_CELL_SIZE           = 10.0;
    private static final Logger log = LoggerFactory.getLogger(SpatialHashGrid.class);

    private final double            cellSize;
    private final int               columns;
    private final int               rows;
    private final List<List<Entry>> cells;
    private       int               count;

    /**
     * Create a grid
     *
     * @param boundary the world region, the grid's origin being its minimum corner
     * @param cellSize side of a square cell
     */
    public SpatialHashGrid(Rectangle boundary, double cellSize) {
        super(boundary);
        if (!(cellSize > 0)) {
            throw new IllegalArgumentException("Cell size must be positive");
        }
        this.cellSize = cellSize;
        this.columns = Math.max(1, (int) Math.ceil(boundary.width() / cellSize));
        this.rows = Math.max(1, (int) Math.ceil(boundary.height() / cellSize));
        this.cells = new ArrayList<>(columns * rows);
        for (int i = 0; i < columns * rows; i++) {
            cells.add(new ArrayList<>());
        }
        log.debug("Spatial hash grid: {}x{} cells, cellSize={}", columns, rows, cellSize);
    }

    /**
     * Create a grid sized for the expected circles: cells of 2.5x the average radius, never smaller than 10 units
     */
    public static SpatialHashGrid forAverageRadius(Rectangle boundary, double averageRadius) {
        return new SpatialHashGrid(boundary, Math.max(MIN_CELL_SIZE, averageRadius * CELL_SIZE_RADIUS_FACTOR));
    }

    /**
     * Find a stored circle that would collide with the candidate, keeping {@code spacing} between surfaces
     *
     * @param circle  the candidate circle
     * @param spacing required gap between surfaces
     * @return the first colliding circle found, if any
     */
    public Optional<Circle> checkCollision(Circle circle, double spacing) {
        if (circle == null) {
            throw new IllegalArgumentException("Circle cannot be null");
        }
        for (var other : queryCircle(circle.x(), circle.y(), circle.radius() + spacing)) {
            if (other == circle) {
                continue;
            }
            if (other.distanceTo(circle) < circle.radius() + other.radius() + spacing) {
                return Optional.of(other);
            }
        }
        return Optional.empty();
    }

    @Override
    public void clear() {
        for (var cell : cells) {
            cell.clear();
        }
        count = 0;
    }

    public double getCellSize() {
        return cellSize;
    }

    public int getColumns() {
        return columns;
    }

    public int getRows() {
        return rows;
    }

    public GridStats getStats() {
        int occupied = 0;
        int registered = 0;
        int max = 0;
        for (var cell : cells) {
            if (!cell.isEmpty()) {
                occupied++;
                registered += cell.size();
                max = Math.max(max, cell.size());
            }
        }
        return new GridStats(cells.size(), occupied, occupied > 0 ? (double) registered / occupied : 0.0, max);
    }

    @Override
    public boolean insert(Circle circle) {
        if (circle == null) {
            throw new IllegalArgumentException("Circle cannot be null");
        }
        if (!circle.intersects(boundary)) {
            return false;
        }
        var bounds = circle.bounds();
        int startColumn = column(bounds.x());
        int endColumn = column(bounds.maxX());
        int startRow = row(bounds.y());
        int endRow = row(bounds.maxY());
        var entry = new Entry(circle);
        for (int r = startRow; r <= endRow; r++) {
            for (int c = startColumn; c <= endColumn; c++) {
                cells.get(r * columns + c).add(entry);
            }
        }
        count++;
        return true;
    }

    @Override
    public List<Circle> query(Rectangle range) {
        if (range == null) {
            throw new IllegalArgumentException("Range cannot be null");
        }
        var found = new ArrayList<Circle>();
        if (!range.intersects(boundary)) {
            return found;
        }
        var seen = Collections.newSetFromMap(new IdentityHashMap<Entry, Boolean>());
        int startColumn = column(range.x());
        int endColumn = column(range.maxX());
        int startRow = row(range.y());
        int endRow = row(range.maxY());
        for (int r = startRow; r <= endRow; r++) {
            for (int c = startColumn; c <= endColumn; c++) {
                for (var entry : cells.get(r * columns + c)) {
                    if (seen.add(entry) && entry.circle.intersects(range)) {
                        found.add(entry.circle);
                    }
                }
            }
        }
        return found;
    }

    @Override
    public int size() {
        return count;
    }

    private static int clamp(double value, int limit) {
        if (!(value > 0)) {
            return 0;
        }
        return (int) Math.min(limit - 1, Math.floor(value));
    }

    private int column(double x) {
        return clamp((x - boundary.x()) / cellSize, columns);
    }

    private int row(double y) {
        return clamp((y - boundary.y()) / cellSize, rows);
    }

    // one per insertion, shared by every cell the circle spans
    private static final class Entry {
        private final Circle circle;

        private Entry(Circle circle) {
            this.circle = circle;
        }
    }
}
