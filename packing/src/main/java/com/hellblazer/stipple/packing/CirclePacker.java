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
import com.hellblazer.stipple.geometry.Rectangle;
import com.hellblazer.stipple.index.CircleIndex;
import com.hellblazer.stipple.index.CircleQuadTree;
import com.hellblazer.stipple.index.SpatialHashGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Random;

/**
 * Procedural circle packing over a canvas spanning [0, width] x [0, height]. Runs largest first: each pass caps radii
 * at half the cap of the previous pass and samples candidates at twice that cap. For every candidate the spatial index
 * supplies the largest collision-free radius; circles clearing the visibility threshold are colored by the sampler and
 * inserted before the next candidate is tried.
 * <p>
 * Placed circles never overlap each other and never cross the canvas edge. The spacing gap is kept with every
 * neighbour the collision query reaches.
 * <p>
 * The index is rebuilt for every run; a packer instance may be reused but not shared between threads.
 *
 * @author hal.hildebrand
 */
public class CirclePacker {

    private static final Logger log = LoggerFactory.getLogger(CirclePacker.class);

    private final PackingConfig config;

    public CirclePacker() {
        this(PackingConfig.defaults());
    }

    public CirclePacker(PackingConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        this.config = config;
    }

    public PackingConfig getConfig() {
        return config;
    }

    /**
     * Pack circles into the canvas
     *
     * @param width   canvas width, positive
     * @param height  canvas height, positive
     * @param sampler supplies the color of each placed circle
     * @return the placed circles and run statistics
     */
    public PackingResult pack(double width, double height, ColorSampler sampler) {
        if (sampler == null) {
            throw new IllegalArgumentException("Color sampler cannot be null");
        }
        if (!(width > 0) || !(height > 0)) {
            throw new IllegalArgumentException("Canvas dimensions must be positive");
        }

        long start = System.nanoTime();
        var canvas = new Rectangle(0, 0, width, height);
        var index = createIndex(canvas);
        var random = new Random(config.getSeed());
        var placed = new ArrayList<Circle>();
        int candidates = 0;
        int rejected = 0;

        double cap = config.getMaxRadius();
        passes:
        for (int pass = 0; pass < config.getPasses(); pass++) {
            double spacing = 2 * Math.max(cap, config.getMinRadius());
            var points = config.getCandidateSampler().sample(canvas, spacing, random);
            int placedInPass = 0;
            for (var point : points) {
                if (placed.size() >= config.getMaxCircles()) {
                    log.debug("Placement budget of {} circles reached in pass {}", config.getMaxCircles(), pass);
                    break passes;
                }
                candidates++;
                double radius = Math.min(cap, index.getMaxRadiusWithoutCollision(point.x, point.y, width, height,
                                                                                  config.getMinSpacing()));
                if (radius < config.getMinRadius()) {
                    rejected++;
                    continue;
                }
                var circle = new Circle(point.x, point.y, radius, sampler.sample(point.x, point.y));
                index.insert(circle);
                placed.add(circle);
                placedInPass++;
            }
            log.debug("Pass {}: radius cap {}, {} candidates, {} placed", pass, cap, points.size(), placedInPass);
            cap = Math.max(cap / 2, config.getMinRadius());
        }

        int depth = index instanceof CircleQuadTree tree ? tree.depth() : 0;
        var elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.info("Packed {} circles into {}x{} from {} candidates ({} rejected) in {} ms", placed.size(), width,
                 height, candidates, rejected, elapsed.toMillis());
        return new PackingResult(placed, candidates, rejected, depth, elapsed);
    }

    private CircleIndex createIndex(Rectangle canvas) {
        return switch (config.getIndexType()) {
            case QUADTREE -> new CircleQuadTree(canvas, config.getCapacity());
            case HASH_GRID -> SpatialHashGrid.forAverageRadius(canvas, config.getMaxRadius() * 0.5);
        };
    }
}
