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

/**
 * Occupancy statistics of a {@link SpatialHashGrid}. A circle spanning several cells counts once per cell.
 *
 * @param totalCells            number of cells in the grid
 * @param occupiedCells         cells holding at least one circle
 * @param averageCirclesPerCell mean circle count over the occupied cells, 0 when none are occupied
 * @param maxCirclesInCell      largest circle count of any cell
 * @author hal.hildebrand
 */
public record GridStats(int totalCells, int occupiedCells, double averageCirclesPerCell, int maxCirclesInCell) {
}
