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
package com.hellblazer.stipple.index;

import com.hellblazer.stipple.geometry.Circle;
import com.hellblazer.stipple.geometry.Quadrant;
import com.hellblazer.stipple.geometry.Rectangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Region quadtree storing circles. Each node owns a list of circles and, once a leaf overflows its capacity, exactly
 * four children tiling its boundary in equal quadrants.
 * <p>
 * A circle is pushed down only when it intersects exactly one child quadrant. Circles straddling a quadrant line stay in
 * the overflow list of the lowest node that contains them, so every stored circle lives in exactly one node and range
 * queries never miss it. The overflow list is not bounded by the capacity: a cluster of large circles around a quadrant
 * line degrades that node toward a linear scan.
 * <p>
 * Subdivision is monotonic until {@link #clear()}. The optional max depth stops subdivision; a leaf at the max depth
 * keeps accepting circles past its capacity.
 * <p>
 * Thread Safety: This class is NOT thread-safe. It is filled by a single writer during a packing pass; a finished tree
 * may be shared read-only.
 *
 * @author hal.hildebrand
 */
public class CircleQuadTree extends AbstractCircleIndex {

    public static final int DEFAULT_CAPACITY  = 10;
    public static final int UNBOUNDED_DEPTH   = Integer.MAX_VALUE;
    private static final Logger log = LoggerFactory.getLogger(CircleQuadTree.class);

    private final int          capacity;
    private final int          level;
    private final int          maxDepth;
    private final List<Circle> circles = new ArrayList<>();

    // indexed by Quadrant.ordinal(); all four or none
    private CircleQuadTree[] children;

    /**
     * Create a quadtree with the default capacity (10) and no depth limit
     */
    public CircleQuadTree(Rectangle boundary) {
        this(boundary, DEFAULT_CAPACITY);
    }

    /**
     * Create a quadtree with no depth limit
     *
     * @param boundary the world region
     * @param capacity circles a leaf holds before it subdivides
     */
    public CircleQuadTree(Rectangle boundary, int capacity) {
        this(boundary, capacity, UNBOUNDED_DEPTH);
    }

    /**
     * Create a quadtree
     *
     * @param boundary the world region
     * @param capacity circles a leaf holds before it subdivides
     * @param maxDepth maximum value of {@link #depth()}, 1 meaning the root never subdivides
     */
    public CircleQuadTree(Rectangle boundary, int capacity, int maxDepth) {
        this(boundary, capacity, maxDepth, 0);
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Max depth must be at least 1");
        }
    }

    private CircleQuadTree(Rectangle boundary, int capacity, int maxDepth, int level) {
        super(boundary);
        this.capacity = capacity;
        this.maxDepth = maxDepth;
        this.level = level;
    }

    @Override
    public void clear() {
        circles.clear();
        children = null;
    }

    /**
     * @return 1 for an undivided leaf, otherwise one more than the deepest child
     */
    public int depth() {
        if (children == null) {
            return 1;
        }
        int deepest = 0;
        for (var child : children) {
            deepest = Math.max(deepest, child.depth());
        }
        return 1 + deepest;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Get a child node
     *
     * @throws IllegalStateException if this node has not subdivided
     */
    public CircleQuadTree getChild(Quadrant quadrant) {
        if (children == null) {
            throw new IllegalStateException("Node is not divided");
        }
        return children[quadrant.ordinal()];
    }

    /**
     * The circles held by this node alone, excluding descendants. For a divided node these are the circles that
     * straddle a quadrant line.
     */
    public List<Circle> getCircles() {
        return Collections.unmodifiableList(circles);
    }

    /**
     * @return 0 for the root, one more per subdivision below it
     */
    public int getLevel() {
        return level;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    @Override
    public boolean insert(Circle circle) {
        if (circle == null) {
            throw new IllegalArgumentException("Circle cannot be null");
        }
        if (!circle.intersects(boundary)) {
            return false;
        }

        if (children == null) {
            if (circles.size() < capacity || level + 1 >= maxDepth) {
                circles.add(circle);
                return true;
            }
            subdivide();
        }

        var child = childFor(circle);
        if (child == null) {
            circles.add(circle);
        } else {
            child.insert(circle);
        }
        return true;
    }

    public boolean isDivided() {
        return children != null;
    }

    @Override
    public List<Circle> query(Rectangle range) {
        if (range == null) {
            throw new IllegalArgumentException("Range cannot be null");
        }
        var found = new ArrayList<Circle>();
        collect(range, found);
        return found;
    }

    /**
     * @return the number of circles stored in this subtree
     */
    @Override
    public int size() {
        int count = circles.size();
        if (children != null) {
            for (var child : children) {
                count += child.size();
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "CircleQuadTree[boundary=" + boundary + ", level=" + level + ", circles=" + circles.size()
        + ", divided=" + isDivided() + "]";
    }

    /**
     * @return the only child whose boundary the circle intersects, or null when it straddles several children
     */
    private CircleQuadTree childFor(Circle circle) {
        CircleQuadTree match = null;
        for (var child : children) {
            if (circle.intersects(child.boundary)) {
                if (match != null) {
                    return null;
                }
                match = child;
            }
        }
        return match;
    }

    private void collect(Rectangle range, List<Circle> found) {
        if (!range.intersects(boundary)) {
            return;
        }
        for (var circle : circles) {
            if (circle.intersects(range)) {
                found.add(circle);
            }
        }
        if (children != null) {
            for (var child : children) {
                child.collect(range, found);
            }
        }
    }

    private void subdivide() {
        var quadrants = Quadrant.values();
        var created = new CircleQuadTree[quadrants.length];
        for (var quadrant : quadrants) {
            created[quadrant.ordinal()] = new CircleQuadTree(boundary.quadrant(quadrant), capacity, maxDepth,
                                                             level + 1);
        }
        children = created;

        var redistribute = new ArrayList<>(circles);
        circles.clear();
        for (var circle : redistribute) {
            var child = childFor(circle);
            if (child == null) {
                circles.add(circle);
            } else {
                child.insert(circle);
            }
        }
        if (log.isTraceEnabled()) {
            log.trace("Subdivided {} at level {}: {} pushed down, {} straddling", boundary, level,
                      redistribute.size() - circles.size(), circles.size());
        }
    }
}
