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

import com.hellblazer.stipple.index.CircleIndex;

/**
 * Configuration of a {@link CirclePacker} run. Controls the spatial index used for collision queries, the radius range
 * of placed circles, the gap between them and the candidate generation.
 *
 * @author hal.hildebrand
 */
public class PackingConfig {

    /**
     * Spatial index backing the collision queries
     */
    public enum IndexType {
        QUADTREE, HASH_GRID
    }

    private int              capacity         = 15;
    private double           minSpacing       = 1.0;
    private double           minRadius        = 1.0;
    private double           maxRadius        = 50.0;
    private int              passes           = 3;
    private int              maxCircles       = Integer.MAX_VALUE;
    private long             seed             = 0L;
    private IndexType        indexType        = IndexType.QUADTREE;
    private CandidateSampler candidateSampler = new JitteredGridSampler();

    /**
     * Sizes suited to a typical canvas of a few hundred to a few thousand units
     */
    public static PackingConfig defaults() {
        return new PackingConfig();
    }

    /**
     * Many small, tightly packed circles
     */
    public static PackingConfig dense() {
        return new PackingConfig().withMinSpacing(0.5)
                                  .withMinRadius(0.5)
                                  .withMaxRadius(30.0)
                                  .withPasses(5)
                                  .withCandidateSampler(new PoissonDiskSampler());
    }

    /**
     * Few large circles with generous gaps
     */
    public static PackingConfig sparse() {
        return new PackingConfig().withMinSpacing(4.0).withMinRadius(3.0).withMaxRadius(80.0).withPasses(2);
    }

    /**
     * Circles a quadtree leaf holds before it subdivides
     */
    public int getCapacity() {
        return capacity;
    }

    public CandidateSampler getCandidateSampler() {
        return candidateSampler;
    }

    public IndexType getIndexType() {
        return indexType;
    }

    /**
     * Placement budget: the run stops once this many circles are placed
     */
    public int getMaxCircles() {
        return maxCircles;
    }

    /**
     * Radius cap of the first, largest pass
     */
    public double getMaxRadius() {
        return maxRadius;
    }

    /**
     * Visibility threshold: candidates whose allowed radius falls below it are rejected
     */
    public double getMinRadius() {
        return minRadius;
    }

    /**
     * Gap kept between circle surfaces
     */
    public double getMinSpacing() {
        return minSpacing;
    }

    /**
     * Number of passes, each halving the radius cap of the previous one
     */
    public int getPasses() {
        return passes;
    }

    public long getSeed() {
        return seed;
    }

    // Fluent API for configuration

    public PackingConfig withCandidateSampler(CandidateSampler sampler) {
        if (sampler == null) {
            throw new IllegalArgumentException("Candidate sampler cannot be null");
        }
        this.candidateSampler = sampler;
        return this;
    }

    public PackingConfig withCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.capacity = capacity;
        return this;
    }

    public PackingConfig withIndexType(IndexType type) {
        if (type == null) {
            throw new IllegalArgumentException("Index type cannot be null");
        }
        this.indexType = type;
        return this;
    }

    public PackingConfig withMaxCircles(int maxCircles) {
        if (maxCircles < 0) {
            throw new IllegalArgumentException("Max circles cannot be negative");
        }
        this.maxCircles = maxCircles;
        return this;
    }

    /**
     * The cap may not exceed {@link CircleIndex#MAX_SEARCH_RADIUS}: beyond it the collision query can miss a neighbour
     * the new circle would overlap.
     */
    public PackingConfig withMaxRadius(double radius) {
        if (!(radius > 0)) {
            throw new IllegalArgumentException("Max radius must be positive");
        }
        if (radius > CircleIndex.MAX_SEARCH_RADIUS) {
            throw new IllegalArgumentException(
            "Max radius cannot exceed the collision search radius " + CircleIndex.MAX_SEARCH_RADIUS);
        }
        this.maxRadius = radius;
        return this;
    }

    public PackingConfig withMinRadius(double radius) {
        if (!(radius > 0)) {
            throw new IllegalArgumentException("Min radius must be positive");
        }
        this.minRadius = radius;
        return this;
    }

    public PackingConfig withMinSpacing(double spacing) {
        if (!(spacing >= 0)) {
            throw new IllegalArgumentException("Min spacing cannot be negative");
        }
        this.minSpacing = spacing;
        return this;
    }

    public PackingConfig withPasses(int passes) {
        if (passes <= 0) {
            throw new IllegalArgumentException("Passes must be positive");
        }
        this.passes = passes;
        return this;
    }

    public PackingConfig withSeed(long seed) {
        this.seed = seed;
        return this;
    }
}
