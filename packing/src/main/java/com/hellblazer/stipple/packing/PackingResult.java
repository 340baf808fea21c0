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

import com.hellblazer.stipple.geometry.Circle;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a packing run
 *
 * @param circles    placed circles, in placement order
 * @param candidates candidate points evaluated
 * @param rejected   candidates whose allowed radius fell below the visibility threshold
 * @param indexDepth depth of the quadtree after the run, 0 for indexes without depth
 * @param elapsed    wall clock time of the run
 * @author hal.hildebrand
 */
public record PackingResult(List<Circle> circles, int candidates, int rejected, int indexDepth, Duration elapsed) {

    public PackingResult {
        circles = List.copyOf(circles);
    }

    public int placed() {
        return circles.size();
    }
}
