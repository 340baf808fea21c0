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
 * Axis-aligned rectangle, used both as an index node boundary and as a query range. Zero-area rectangles are valid and
 * behave as points or segments. A rectangle with a negative or NaN extent is degenerate and intersects nothing.
 *
 * @author hal.hildebrand
 */
public record Rectangle(double x, double y, double width, double height) {

    /**
     * The axis-aligned bounding square of a circle
     */
    public static Rectangle around(double centerX, double centerY, double radius) {
        return new Rectangle(centerX - radius, centerY - radius, radius * 2, radius * 2);
    }

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }

    /**
     * Closed containment test
     */
    public boolean contains(double px, double py) {
        return !isDegenerate() && px >= x && px <= maxX() && py >= y && py <= maxY();
    }

    public boolean intersects(Rectangle other) {
        return Intersections.rectanglesIntersect(this, other);
    }

    public boolean isDegenerate() {
        // written this way so NaN extents are degenerate too
        return !(width >= 0) || !(height >= 0);
    }

    public double maxX() {
        return x + width;
    }

    public double maxY() {
        return y + height;
    }

    /**
     * The quadrant of this rectangle: exactly half the width and half the height, tiling the parent with its three
     * siblings
     */
    public Rectangle quadrant(Quadrant quadrant) {
        double w = width / 2;
        double h = height / 2;
        return new Rectangle(x + quadrant.xOffset() * w, y + quadrant.yOffset() * h, w, h);
    }
}
