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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

import javax.vecmath.Color3f;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the multi-pass circle packer
 *
 * @author hal.hildebrand
 */
@DisplayName("Circle Packer Tests")
public class CirclePackerTest {

    private static final double WIDTH  = 400;
    private static final double HEIGHT = 300;

    private final ColorSampler white = ColorSampler.constant(new Color3f(1, 1, 1));

    private static void assertPacked(List<Circle> circles, PackingConfig config) {
        for (var circle : circles) {
            assertTrue(circle.radius() >= config.getMinRadius(), "below visibility threshold: " + circle);
            assertTrue(circle.radius() <= config.getMaxRadius(), "above radius cap: " + circle);
            assertTrue(circle.x() - circle.radius() >= 0 && circle.x() + circle.radius() <= WIDTH,
                       "crosses a vertical edge: " + circle);
            assertTrue(circle.y() - circle.radius() >= 0 && circle.y() + circle.radius() <= HEIGHT,
                       "crosses a horizontal edge: " + circle);
        }
        for (int i = 0; i < circles.size(); i++) {
            for (int j = i + 1; j < circles.size(); j++) {
                var a = circles.get(i);
                var b = circles.get(j);
                assertTrue(a.distanceTo(b) >= a.radius() + b.radius() - 1e-9, "overlap: " + a + " " + b);
            }
        }
    }

    @ParameterizedTest
    @EnumSource(PackingConfig.IndexType.class)
    @DisplayName("Placed circles never overlap and stay on the canvas")
    void testNoOverlap(PackingConfig.IndexType indexType) {
        var config = PackingConfig.defaults().withIndexType(indexType).withSeed(17);
        var result = new CirclePacker(config).pack(WIDTH, HEIGHT, white);

        assertTrue(result.placed() > 10);
        assertEquals(result.candidates(), result.placed() + result.rejected());
        assertPacked(result.circles(), config);
        if (indexType == PackingConfig.IndexType.QUADTREE) {
            assertTrue(result.indexDepth() >= 1);
        } else {
            assertEquals(0, result.indexDepth());
        }
    }

    @Test
    @DisplayName("Dense preset with Poisson-disk candidates")
    void testDensePreset() {
        var config = PackingConfig.dense().withSeed(3);
        var result = new CirclePacker(config).pack(WIDTH, HEIGHT, white);

        assertTrue(result.placed() > 100);
        assertPacked(result.circles(), config);
    }

    @Test
    @DisplayName("A fixed seed reproduces the same packing")
    void testDeterministic() {
        var first = new CirclePacker(PackingConfig.defaults().withSeed(99)).pack(WIDTH, HEIGHT, white);
        var second = new CirclePacker(PackingConfig.defaults().withSeed(99)).pack(WIDTH, HEIGHT, white);

        assertEquals(first.circles(), second.circles());
        assertEquals(first.candidates(), second.candidates());
        assertEquals(first.rejected(), second.rejected());
    }

    @Test
    @DisplayName("The placement budget stops the run")
    void testMaxCircles() {
        var limited = new CirclePacker(PackingConfig.defaults().withMaxCircles(5)).pack(WIDTH, HEIGHT, white);
        assertEquals(5, limited.placed());

        var none = new CirclePacker(PackingConfig.defaults().withMaxCircles(0)).pack(WIDTH, HEIGHT, white);
        assertEquals(0, none.placed());
        assertEquals(0, none.candidates());
    }

    @Test
    @DisplayName("The color sampler is consulted once per placed circle")
    void testColorSampling() {
        var red = new Color3f(1, 0, 0);
        var sampler = Mockito.mock(ColorSampler.class);
        Mockito.when(sampler.sample(ArgumentMatchers.anyDouble(), ArgumentMatchers.anyDouble())).thenReturn(red);

        var result = new CirclePacker().pack(WIDTH, HEIGHT, sampler);

        assertTrue(result.placed() > 0);
        Mockito.verify(sampler, Mockito.times(result.placed()))
               .sample(ArgumentMatchers.anyDouble(), ArgumentMatchers.anyDouble());
        for (var circle : result.circles()) {
            assertEquals(red, circle.color());
            Mockito.verify(sampler).sample(circle.x(), circle.y());
        }
    }

    @Test
    @DisplayName("A sampler returning null colors circles black")
    void testNullColor() {
        var result = new CirclePacker().pack(WIDTH, HEIGHT, (x, y) -> null);
        assertTrue(result.placed() > 0);
        assertTrue(result.circles().stream().allMatch(c -> c.color().equals(new Color3f())));
    }

    @Test
    @DisplayName("The first pass places the largest circles")
    void testLargestFirst() {
        var config = PackingConfig.defaults().withPasses(1).withMaxRadius(20);
        var single = new CirclePacker(config).pack(WIDTH, HEIGHT, white);
        var multi = new CirclePacker(config.withPasses(3)).pack(WIDTH, HEIGHT, white);

        // later passes only add smaller circles after the first pass is complete
        assertEquals(single.circles(), multi.circles().subList(0, single.placed()));
        for (var circle : multi.circles().subList(single.placed(), multi.placed())) {
            assertTrue(circle.radius() <= 10.0, "later pass exceeds its cap: " + circle);
        }
    }

    @Test
    void testArgumentValidation() {
        var packer = new CirclePacker();
        assertThrows(IllegalArgumentException.class, () -> new CirclePacker(null));
        assertThrows(IllegalArgumentException.class, () -> packer.pack(WIDTH, HEIGHT, null));
        assertThrows(IllegalArgumentException.class, () -> packer.pack(0, HEIGHT, white));
        assertThrows(IllegalArgumentException.class, () -> packer.pack(WIDTH, -1, white));
        assertThrows(IllegalArgumentException.class, () -> packer.pack(Double.NaN, HEIGHT, white));
    }
}
