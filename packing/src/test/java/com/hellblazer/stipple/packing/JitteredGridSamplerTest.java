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
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class JitteredGridSamplerTest {

    private final Rectangle canvas = new Rectangle(0, 0, 100, 50);

    @Test
    void testOnePointPerCell() {
        var points = new JitteredGridSampler().sample(canvas, 10, new Random(1));
        assertEquals(50, points.size());
        for (var point : points) {
            assertTrue(canvas.contains(point.x, point.y), "outside canvas: " + point);
        }

        // partial cells at the far edges still get a candidate
        assertEquals(12, new JitteredGridSampler().sample(new Rectangle(0, 0, 35, 25), 10, new Random(1)).size());
    }

    @Test
    void testZeroJitterUsesCellCenters() {
        var points = new JitteredGridSampler(0).sample(canvas, 10, new Random(5));
        assertEquals(50, points.size());
        for (var point : points) {
            assertEquals(0.0, (point.x - 5) % 10, 1e-9);
            assertEquals(0.0, (point.y - 5) % 10, 1e-9);
        }
    }

    @Test
    void testSameSeedSamePoints() {
        var sampler = new JitteredGridSampler();
        assertEquals(sampler.sample(canvas, 7, new Random(11)), sampler.sample(canvas, 7, new Random(11)));
    }

    @Test
    void testDegenerateInputs() {
        var sampler = new JitteredGridSampler();
        assertTrue(sampler.sample(new Rectangle(0, 0, -1, 10), 5, new Random(0)).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> sampler.sample(canvas, 0, new Random(0)));
        assertThrows(IllegalArgumentException.class, () -> new JitteredGridSampler(-0.1));
        assertThrows(IllegalArgumentException.class, () -> new JitteredGridSampler(1.5));
    }
}
