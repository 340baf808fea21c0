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
package com.hellblazer.stipple.geometry;

/**
 * Utility class for the 2D intersection tests used by the circle indexes. All tests are closed: touching shapes
 * intersect. Degenerate rectangles intersect nothing.
 *
 * @author hal.hildebrand
 */
public final class Intersections {

    private Intersections() {
    }

    /**
     * Test if a circle intersects an axis-aligned rectangle. The circle's center is clamped into the rectangle and the
     * squared distance to the clamped point is compared with the squared radius, so this is a true circle/AABB test
     * rather than a bounding box check.
     *
     * @param cx     circle center x
     * @param cy     circle center y
     * @param radius circle radius
     * @param rect   the rectangle
     * @return true if the circle and the rectangle overlap
     */
    public static boolean circleIntersectsRectangle(double cx, double cy, double radius, Rectangle rect) {
        if (rect.isDegenerate()) {
            return false;
        }
        double closestX = Math.max(rect.x(), Math.min(cx, rect.maxX()));
        double closestY = Math.max(rect.y(), Math.min(cy, rect.maxY()));

        double dx = cx - closestX;
        double dy = cy - closestY;
        return dx * dx + dy * dy <= radius * radius;
    }

    /**
     * Test if two circles overlap, center distance against the sum of the radii
     */
    public static boolean circlesIntersect(double x1, double y1, double r1, double x2, double y2, double r2) {
        double dx = x1 - x2;
        double dy = y1 - y2;
        return Math.sqrt(dx * dx + dy * dy) <= r1 + r2;
    }

    /**
     * Separating axis test on two axis-aligned rectangles
     */
    public static boolean rectanglesIntersect(Rectangle a, Rectangle b) {
        if (a.isDegenerate() || b.isDegenerate()) {
            return false;
        }
        return !(a.x() > b.maxX() || a.maxX() < b.x() || a.y() > b.maxY() || a.maxY() < b.y());
    }
}
