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
import java.util.List;
import java.util.Random;

/**
 * Strategy generating the candidate placement points of one packing pass.
 *
 * @author hal.hildebrand
 */
public interface CandidateSampler {

    /**
     * Generate candidate points inside the canvas, in the order they should be tried
     *
     * @param canvas  region to cover
     * @param spacing nominal distance between neighbouring candidates, positive
     * @param random  source of randomness, making runs reproducible for a fixed seed
     * @return the candidate points
     */
    List<Point2d> sample(Rectangle canvas, double spacing, Random random);
}
