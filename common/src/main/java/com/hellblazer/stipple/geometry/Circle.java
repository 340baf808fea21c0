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

import javax.vecmath.Color3f;

/**
 * Immutable circle with an opaque RGB color. The color is carried for the renderer and never interpreted by the
 * spatial indexes. Coordinates live in whatever 2D space the caller chooses (pixels, normalized units), as long as it
 * is consistent across one index.
 * <p>
 * Negative radii are floored to zero. The color is copied on the way in and on the way out, so a circle never aliases
 * a caller owned {@link Color3f}.
 *
 * @param x      center x
 * @param y      center y
 * @param radius radius, never negative
 * @param color  RGB color, black when constructed with null
 * @author hal.hildebrand
 */
public record Circle(double x, double y, double radius, Color3f color) {

    public Circle {
        radius = Math.max(0.0, radius);
        color = color == null ? new Color3f() : new Color3f(color);
    }

    /**
     * Create a black circle
     */
    public Circle(double x, double y, double radius) {
        this(x, y, radius, null);
    }

    /**
     * Axis-aligned bounding square of this circle
     */
    public Rectangle bounds() {
        return Rectangle.around(x, y, radius);
    }

    @Override
    public Color3f color() {
        return new Color3f(color);
    }

    /**
     * Euclidean distance from this circle's center to the point
     */
    public double distanceTo(double px, double py) {
        double dx = x - px;
        double dy = y - py;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Euclidean distance between the two centers
     */
    public double distanceTo(Circle other) {
        return distanceTo(other.x, other.y);
    }

    /**
     * Closed circle/circle overlap: tangent circles intersect
     */
    public boolean intersects(Circle other) {
        return Intersections.circlesIntersect(x, y, radius, other.x, other.y, other.radius);
    }

    /**
     * Closed circle/AABB overlap
     */
    public boolean intersects(Rectangle rectangle) {
        return Intersections.circleIntersectsRectangle(x, y, radius, rectangle);
    }

    public Circle withColor(Color3f newColor) {
        return new Circle(x, y, radius, newColor);
    }

    public Circle withRadius(double newRadius) {
        return new Circle(x, y, newRadius, color);
    }
}
