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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * One candidate per grid cell of side {@code spacing}, displaced from the cell center by up to half the jitter fraction
 * of the cell on each axis. The points are shuffled so a pass does not sweep the canvas in raster order.
 *
 * @author hal.hildebrand
 */
public class JitteredGridSampler implements CandidateSampler {

    public static final double DEFAULT_JITTER = 0.8;

    private final double jitter;

    public JitteredGridSampler() {
        this(DEFAULT_JITTER);
    }

    /**
     * @param jitter fraction of the cell the candidate may wander, 0 for exact cell centers, 1 for anywhere in the cell
     */
    public JitteredGridSampler(double jitter) {
        if (!(jitter >= 0 && jitter <= 1)) {
            throw new IllegalArgumentException("Jitter must be in [0, 1]");
        }
        this.jitter = jitter;
    }

    public double getJitter() {
        return jitter;
    }

    @Override
    public List<Point2d> sample(Rectangle canvas, double spacing, Random random) {
        if (!(spacing > 0)) {
            throw new IllegalArgumentException("Spacing must be positive");
        }
        var points = new ArrayList<Point2d>();
        if (canvas.isDegenerate()) {
            return points;
        }
        int columns = Math.max(1, (int) Math.ceil(canvas.width() / spacing));
        int rows = Math.max(1, (int) Math.ceil(canvas.height() / spacing));
        for (int row = 0; row < rows; row++) {
            for (int column = 0; column < columns; column++) {
                double x = canvas.x() + (column + 0.5) * spacing + (random.nextDouble() - 0.5) * spacing * jitter;
                double y = canvas.y() + (row + 0.5) * spacing + (random.nextDouble() - 0.5) * spacing * jitter;
                points.add(new Point2d(Math.min(canvas.maxX(), Math.max(canvas.x(), x)),
                                       Math.min(canvas.maxY(), Math.max(canvas.y(), y))));
            }
        }
        Collections.shuffle(points, random);
        return points;
    }
}
