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

import javax.vecmath.Color3f;

/**
 * Source of the color given to a circle placed at a canvas point, typically backed by the image being stylized.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface ColorSampler {

    /**
     * A sampler returning the same color everywhere
     */
    static ColorSampler constant(Color3f color) {
        var copy = new Color3f(color);
        return (x, y) -> new Color3f(copy);
    }

    /**
     * @return the color at the canvas point; null is treated as black
     */
    Color3f sample(double x, double y);
}
