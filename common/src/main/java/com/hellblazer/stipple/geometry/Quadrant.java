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
 * The four quadrants of a rectangle in screen orientation: y grows southward, so "north" is the half with the smaller
 * y.
 *
 * @author hal.hildebrand
 */
public enum Quadrant {
    NORTHEAST(1, 0), NORTHWEST(0, 0), SOUTHEAST(1, 1), SOUTHWEST(0, 1);

    private final int xOffset;
    private final int yOffset;

    Quadrant(int xOffset, int yOffset) {
        this.xOffset = xOffset;
        this.yOffset = yOffset;
    }

    /**
     * @return 0 for the west half, 1 for the east half
     */
    public int xOffset() {
        return xOffset;
    }

    /**
     * @return 0 for the north half, 1 for the south half
     */
    public int yOffset() {
        return yOffset;
    }
}
