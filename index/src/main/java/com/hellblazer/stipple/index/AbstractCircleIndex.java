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

import java.util.ArrayList;
import java.util.List;

/**
 * Base implementation of the derived circle queries. Subclasses supply storage through {@link #insert(Circle)} and
 * {@link #query(Rectangle)}; the circle neighborhood and collision-free radius computations are shared.
 *
 * @author hal.hildebrand
 */
public abstract class AbstractCircleIndex implements CircleIndex {

    protected final Rectangle boundary;

    protected AbstractCircleIndex(Rectangle boundary) {
        if (boundary == null) {
            throw new IllegalArgumentException("Boundary cannot be null");
        }
        this.boundary = boundary;
    }

    @Override
    public Rectangle getBoundary() {
        return boundary;
    }

    @Override
    public double getMaxRadiusWithoutCollision(double x, double y, double canvasWidth, double canvasHeight,
                                               double minSpacing) {
        double edgeDistance = Math.min(Math.min(x, y), Math.min(canvasWidth - x, canvasHeight - y));
        double edgeBound = Math.max(0.0, edgeDistance * EDGE_SAFETY_FACTOR);

        double searchRadius = Math.min(edgeDistance, MAX_SEARCH_RADIUS);
        var nearby = queryCircle(x, y, searchRadius);
        if (nearby.isEmpty()) {
            return edgeBound;
        }

        double circleBound = Double.POSITIVE_INFINITY;
        for (var circle : nearby) {
            double allowed = circle.distanceTo(x, y) - circle.radius() - minSpacing;
            circleBound = Math.min(circleBound, allowed);
        }
        return Math.max(0.0, Math.min(edgeBound, circleBound * CIRCLE_SAFETY_FACTOR));
    }

    @Override
    public List<Circle> getNearbyCircles(double x, double y, double radius) {
        return queryCircle(x, y, radius * NEARBY_SEARCH_MULTIPLIER);
    }

    @Override
    public List<Circle> queryCircle(double x, double y, double radius) {
        var candidates = query(Rectangle.around(x, y, radius));
        var found = new ArrayList<Circle>(candidates.size());
        for (var circle : candidates) {
            if (circle.distanceTo(x, y) <= radius + circle.radius()) {
                found.add(circle);
            }
        }
        return found;
    }
}
