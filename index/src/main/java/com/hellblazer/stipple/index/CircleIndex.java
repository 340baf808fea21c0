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

import javax.vecmath.Tuple2d;
import java.util.List;

/**
 * Spatial index over circles, supporting the collision queries of procedural circle packing. Implementations are
 * rebuilt per packing pass: they are filled by one writer and queried on the same call stack.
 * <p>
 * Geometric inputs never raise errors. Degenerate ranges produce empty results and radii are floored at zero. Null
 * arguments are programming errors and raise {@link IllegalArgumentException}.
 *
 * @author hal.hildebrand
 */
public interface CircleIndex {

    /**
     * Factor applied to the caller's radius by {@link #getNearbyCircles(double, double, double)}. This is a heuristic:
     * it assumes no placed circle within the collision zone is large enough to reach past 2.5x the radius, which holds
     * for typical packing distributions but not universally.
     */
    double NEARBY_SEARCH_MULTIPLIER = 2.5;

    /**
     * Upper bound on the search radius of {@link #getMaxRadiusWithoutCollision}, bounding query cost far from any
     * canvas edge.
     */
    double MAX_SEARCH_RADIUS = 100.0;

    /**
     * Margin applied to the canvas edge distance
     */
    double EDGE_SAFETY_FACTOR = 0.95;

    /**
     * Margin applied to the bound derived from neighbouring circles. Tangent-exact circles leave visible seams.
     */
    double CIRCLE_SAFETY_FACTOR = 0.9;

    /**
     * Remove every circle. Afterward {@link #size()} is zero and every query is empty.
     */
    void clear();

    /**
     * @return the region covered by this index
     */
    Rectangle getBoundary();

    /**
     * Compute the largest radius a new circle centered at (x, y) may take without overlapping the canvas edges or any
     * stored circle, keeping a gap of {@code minSpacing} between circle surfaces.
     *
     * @param x            center x of the prospective circle
     * @param y            center y of the prospective circle
     * @param canvasWidth  canvas width, the canvas spanning [0, canvasWidth]
     * @param canvasHeight canvas height, the canvas spanning [0, canvasHeight]
     * @param minSpacing   required gap between circle surfaces
     * @return the allowed radius, never negative
     */
    double getMaxRadiusWithoutCollision(double x, double y, double canvasWidth, double canvasHeight, double minSpacing);

    /**
     * Find the circles that may collide with a new circle of the given radius, before the final radius is known. The
     * search radius is {@code radius * NEARBY_SEARCH_MULTIPLIER}.
     */
    List<Circle> getNearbyCircles(double x, double y, double radius);

    /**
     * Insert a circle.
     *
     * @param circle the circle to store
     * @return false if the circle does not intersect this index's boundary, true once it is stored
     */
    boolean insert(Circle circle);

    /**
     * Find every stored circle that intersects the range. Each circle is reported once, in no particular order.
     */
    List<Circle> query(Rectangle range);

    /**
     * Find every stored circle that truly intersects the query circle: center distance at most {@code radius} plus the
     * stored circle's radius.
     */
    List<Circle> queryCircle(double x, double y, double radius);

    default List<Circle> queryCircle(Tuple2d center, double radius) {
        if (center == null) {
            throw new IllegalArgumentException("Center cannot be null");
        }
        return queryCircle(center.x, center.y, radius);
    }

    /**
     * @return the number of stored circles
     */
    int size();
}
