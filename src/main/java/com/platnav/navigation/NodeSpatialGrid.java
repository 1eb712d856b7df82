package com.platnav.navigation;

import com.platnav.geometry.Vec2;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Uniform grid index over node positions for nearest-node and range queries.
 *
 * <p>The plane is cut into square cells of {@code cellSize}; each cell keeps the indices
 * (into the node list passed to {@link #build}) of the nodes inside it. Queries then look
 * at a handful of cells instead of every node.
 *
 * <p>The index is a derived view of one node list. It is rebuilt from scratch whenever the
 * list changes, never patched.
 *
 * <p>Performance characteristics:
 * <ul>
 *   <li>Build: O(n)</li>
 *   <li>Nearest: rings of cells around the query cell, stopping once the next ring cannot
 *       hold anything closer</li>
 *   <li>Range: only the cells whose footprint can intersect the query disk</li>
 * </ul>
 *
 * <p>Read queries are safe from several threads once built, as long as nobody rebuilds or
 * clears the index concurrently.
 *
 * @see PlatformGraphGenerator
 */
@Slf4j
public class NodeSpatialGrid {

    private final double cellSize;

    /**
     * Packed cell coordinate -> indices of the nodes in that cell.
     */
    private final Map<Long, List<Integer>> grid = new HashMap<>();

    private List<PlatformNode> nodes = Collections.emptyList();

    // Occupied cell bounds, to stop ring expansion once past every node
    private int minCellX;
    private int maxCellX;
    private int minCellY;
    private int maxCellY;

    private boolean built = false;

    /**
     * @param cellSize cell side length, must be positive
     */
    public NodeSpatialGrid(double cellSize) {
        if (!(cellSize > 0)) {
            throw new IllegalArgumentException("Cell size must be positive, was " + cellSize);
        }
        this.cellSize = cellSize;
    }

    public double getCellSize() {
        return cellSize;
    }

    public boolean isBuilt() {
        return built;
    }

    // ========================================================================
    // Index Management
    // ========================================================================

    /**
     * Index a node list, replacing any previous content.
     *
     * <p>The grid keeps a reference to the list; callers must not modify it afterwards.
     *
     * @param nodes the nodes to index
     */
    public void build(List<PlatformNode> nodes) {
        grid.clear();
        this.nodes = nodes;
        minCellX = Integer.MAX_VALUE;
        minCellY = Integer.MAX_VALUE;
        maxCellX = Integer.MIN_VALUE;
        maxCellY = Integer.MIN_VALUE;

        for (int i = 0; i < nodes.size(); i++) {
            Vec2 position = nodes.get(i).getPosition();
            int cellX = toCell(position.getX());
            int cellY = toCell(position.getY());

            grid.computeIfAbsent(packKey(cellX, cellY), k -> new ArrayList<>(8)).add(i);

            minCellX = Math.min(minCellX, cellX);
            maxCellX = Math.max(maxCellX, cellX);
            minCellY = Math.min(minCellY, cellY);
            maxCellY = Math.max(maxCellY, cellY);
        }

        built = true;
        log.debug("NodeSpatialGrid built: {}", getStats());
    }

    /**
     * Drop all indexed content.
     */
    public void clear() {
        grid.clear();
        nodes = Collections.emptyList();
        built = false;
    }

    // ========================================================================
    // Query API
    // ========================================================================

    /**
     * Find the node closest to a position.
     *
     * <p>Searches ring by ring outwards from the query cell. The nearest point of ring
     * {@code r + 1} is at least {@code r * cellSize} away from any point of the query cell,
     * so the search stops once that bound exceeds the best distance found or
     * {@code maxDistance}.
     *
     * @param position    query position
     * @param maxDistance only nodes strictly closer than this are returned
     * @return the nearest node, or empty if none is in range or the index is empty
     */
    public Optional<PlatformNode> findNearest(Vec2 position, double maxDistance) {
        if (!built || nodes.isEmpty() || !(maxDistance > 0)) {
            return Optional.empty();
        }

        int cx = toCell(position.getX());
        int cy = toCell(position.getY());

        // Rings before this one lie entirely outside the occupied cells
        long startRing = Math.max(outside(cx, minCellX, maxCellX), outside(cy, minCellY, maxCellY));
        // Past this ring every occupied cell has been visited
        long maxRing = Math.max(
                Math.max(Math.abs((long) cx - minCellX), Math.abs((long) maxCellX - cx)),
                Math.max(Math.abs((long) cy - minCellY), Math.abs((long) maxCellY - cy)));

        NearestCandidate best = new NearestCandidate(maxDistance * maxDistance);

        for (long ring = startRing; ring <= maxRing; ring++) {
            double ringMinDist = Math.max(0, ring - 1) * cellSize;
            if (ringMinDist > maxDistance) {
                break;
            }
            if (best.node != null && ringMinDist * ringMinDist > best.distSq) {
                break;
            }
            scanRing(cx, cy, (int) ring, position, best);
        }

        return Optional.ofNullable(best.node);
    }

    /**
     * Visit the border cells of one ring, skipping cells outside the occupied bounds.
     */
    private void scanRing(int cx, int cy, int ring, Vec2 position, NearestCandidate best) {
        int loX = Math.max(cx - ring, minCellX);
        int hiX = Math.min(cx + ring, maxCellX);

        // Top and bottom rows, corners included
        int[] rows = ring == 0 ? new int[]{cy} : new int[]{cy - ring, cy + ring};
        for (int cellY : rows) {
            if (cellY < minCellY || cellY > maxCellY) {
                continue;
            }
            for (int cellX = loX; cellX <= hiX; cellX++) {
                scanCell(cellX, cellY, position, best);
            }
        }

        if (ring == 0) {
            return;
        }

        // Left and right columns, corners excluded
        int loY = Math.max(cy - ring + 1, minCellY);
        int hiY = Math.min(cy + ring - 1, maxCellY);
        for (int cellX : new int[]{cx - ring, cx + ring}) {
            if (cellX < minCellX || cellX > maxCellX) {
                continue;
            }
            for (int cellY = loY; cellY <= hiY; cellY++) {
                scanCell(cellX, cellY, position, best);
            }
        }
    }

    private void scanCell(int cellX, int cellY, Vec2 position, NearestCandidate best) {
        List<Integer> indices = grid.get(packKey(cellX, cellY));
        if (indices == null) {
            return;
        }
        for (int index : indices) {
            PlatformNode node = nodes.get(index);
            double distSq = position.distanceSquaredTo(node.getPosition());
            if (distSq < best.distSq) {
                best.distSq = distSq;
                best.node = node;
            }
        }
    }

    /**
     * Distance, in cells, from a cell coordinate to the range [min, max]; 0 if inside.
     */
    private static long outside(int cell, int min, int max) {
        if (cell < min) {
            return (long) min - cell;
        }
        if (cell > max) {
            return (long) cell - max;
        }
        return 0;
    }

    /**
     * Collect every node within {@code radius} of a position (inclusive).
     *
     * <p>The results buffer is cleared first and then filled, so a caller can reuse one
     * buffer across calls without allocating.
     *
     * @param position query center
     * @param radius   query radius
     * @param results  output buffer, cleared before use
     */
    public void findNodesInRange(Vec2 position, double radius, List<PlatformNode> results) {
        results.clear();
        if (!built || nodes.isEmpty() || radius < 0) {
            return;
        }

        int minX = toCell(position.getX() - radius);
        int maxX = toCell(position.getX() + radius);
        int minY = toCell(position.getY() - radius);
        int maxY = toCell(position.getY() + radius);

        // Clamp to occupied cells so huge radii do not walk empty space
        minX = Math.max(minX, minCellX);
        maxX = Math.min(maxX, maxCellX);
        minY = Math.max(minY, minCellY);
        maxY = Math.min(maxY, maxCellY);

        double radiusSq = radius * radius;

        for (int cellX = minX; cellX <= maxX; cellX++) {
            for (int cellY = minY; cellY <= maxY; cellY++) {
                List<Integer> indices = grid.get(packKey(cellX, cellY));
                if (indices == null) {
                    continue;
                }

                for (int index : indices) {
                    PlatformNode node = nodes.get(index);
                    if (position.distanceSquaredTo(node.getPosition()) <= radiusSq) {
                        results.add(node);
                    }
                }
            }
        }
    }

    /**
     * Indices of the nodes in the cell containing a position.
     *
     * @return unmodifiable index list, empty if the cell holds no node
     */
    public List<Integer> getNodeIndicesInCell(Vec2 position) {
        List<Integer> indices = grid.get(packKey(toCell(position.getX()), toCell(position.getY())));
        return indices != null ? Collections.unmodifiableList(indices) : Collections.emptyList();
    }

    // ========================================================================
    // Linear Scans
    // ========================================================================

    /**
     * Brute-force nearest node. Same contract as {@link #findNearest}.
     */
    public static Optional<PlatformNode> findNearestLinear(List<PlatformNode> nodes, Vec2 position, double maxDistance) {
        PlatformNode nearest = null;
        double nearestDistSq = maxDistance * maxDistance;
        for (PlatformNode node : nodes) {
            double distSq = position.distanceSquaredTo(node.getPosition());
            if (distSq < nearestDistSq) {
                nearestDistSq = distSq;
                nearest = node;
            }
        }
        return Optional.ofNullable(nearest);
    }

    /**
     * Brute-force range query. Same contract as {@link #findNodesInRange}.
     */
    public static void findNodesInRangeLinear(List<PlatformNode> nodes, Vec2 position, double radius,
                                              List<PlatformNode> results) {
        results.clear();
        if (radius < 0) {
            return;
        }
        double radiusSq = radius * radius;
        for (PlatformNode node : nodes) {
            if (position.distanceSquaredTo(node.getPosition()) <= radiusSq) {
                results.add(node);
            }
        }
    }

    // ========================================================================
    // Utility Methods
    // ========================================================================

    private int toCell(double coordinate) {
        return (int) Math.floor(coordinate / cellSize);
    }

    /**
     * Pack a cell coordinate pair into one collision-free key.
     */
    private static long packKey(int cellX, int cellY) {
        return ((long) cellX << 32) | (cellY & 0xFFFFFFFFL);
    }

    /**
     * Get statistics for monitoring.
     *
     * @return formatted statistics string
     */
    public String getStats() {
        int maxPerCell = 0;
        for (List<Integer> indices : grid.values()) {
            maxPerCell = Math.max(maxPerCell, indices.size());
        }
        double avgPerCell = grid.isEmpty() ? 0 : (double) nodes.size() / grid.size();
        return String.format("NodeSpatialGrid[cellSize=%.2f, cells=%d, nodes=%d, max/cell=%d, avg/cell=%.1f]",
                cellSize, grid.size(), nodes.size(), maxPerCell, avgPerCell);
    }

    // ========================================================================
    // Inner Classes
    // ========================================================================

    /**
     * Best match so far during a nearest search.
     */
    private static class NearestCandidate {
        PlatformNode node;
        double distSq;

        NearestCandidate(double distSq) {
            this.distSq = distSq;
        }
    }
}
