package com.platnav.navigation;

import com.platnav.config.PlatformGraphConfig;
import com.platnav.geometry.RaycastHit;
import com.platnav.geometry.ShapeQueryProvider;
import com.platnav.geometry.Vec2;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds the walkable top edges of a shape's outline.
 *
 * <p>Each path is walked as a closed loop. An edge is a candidate when it is wide enough
 * and no steeper than the slope threshold. Candidates are then verified with a downward
 * ray cast from standing height above the edge midpoint: the edge is a top surface only
 * if the ray lands on it (not on something above it) with enough headroom. This rejects
 * undersides and surfaces buried inside other geometry.
 *
 * <p>Accepted edges of all paths of a shape are post-processed together:
 * <ol>
 *   <li>{@link #mergeAdjacentEdges merge} touching edges at the same height</li>
 *   <li>{@link #deduplicateCloseEdges deduplicate} overlapping edges at nearly the same
 *       height, keeping the highest</li>
 * </ol>
 *
 * <p>The raycast thresholds are heuristics. They should be tuned against real level
 * geometry rather than treated as exact.
 */
@Slf4j
public class TopEdgeExtractor {

    private final ShapeQueryProvider shapeQueryProvider;
    private final PlatformGraphConfig config;

    public TopEdgeExtractor(ShapeQueryProvider shapeQueryProvider, PlatformGraphConfig config) {
        this.shapeQueryProvider = shapeQueryProvider;
        this.config = config;
    }

    // ========================================================================
    // Extraction
    // ========================================================================

    /**
     * Extract the walkable top edges of a multi-path shape.
     *
     * @param paths world-space point loops of one shape
     * @return merged and deduplicated top edges
     */
    public List<SurfaceEdge> extractTopEdges(List<List<Vec2>> paths) {
        List<SurfaceEdge> candidates = new ArrayList<>();
        for (List<Vec2> path : paths) {
            candidates.addAll(findTopEdges(path));
        }
        List<SurfaceEdge> merged = mergeAdjacentEdges(candidates, config.getEdgeMergeThreshold());
        return deduplicateCloseEdges(merged, config.getEdgeDedupThreshold());
    }

    /**
     * Find the raycast-verified top edges of a single closed path, before post-processing.
     *
     * @param points world-space loop; the last point connects back to the first
     * @return accepted edges, empty for degenerate paths with fewer than 3 points
     */
    public List<SurfaceEdge> findTopEdges(List<Vec2> points) {
        List<SurfaceEdge> edges = new ArrayList<>();
        if (points == null || points.size() < 3) {
            return edges;
        }

        int count = points.size();
        for (int i = 0; i < count; i++) {
            Vec2 p1 = points.get(i);
            Vec2 p2 = points.get((i + 1) % count);
            if (p1 == null || p2 == null) {
                continue;
            }

            double dx = Math.abs(p2.getX() - p1.getX());
            double dy = Math.abs(p2.getY() - p1.getY());

            // Walls
            if (dx < config.getMinEdgeSpan()) {
                continue;
            }
            if (dy / dx > config.getSlopeThreshold()) {
                continue;
            }

            Vec2 mid = new Vec2((p1.getX() + p2.getX()) / 2.0, (p1.getY() + p2.getY()) / 2.0);
            if (!isStandable(mid)) {
                log.debug("Rejected edge {} -> {}: raycast verification failed", p1, p2);
                continue;
            }

            edges.add(new SurfaceEdge(
                    Math.min(p1.getX(), p2.getX()),
                    Math.max(p1.getX(), p2.getX()),
                    mid.getY()));
        }
        return edges;
    }

    /**
     * Cast down from standing height above a point and check that it lands on the point's
     * surface with enough headroom.
     */
    private boolean isStandable(Vec2 surfacePoint) {
        double standingHeight = config.getStandingHeight();
        Vec2 rayOrigin = new Vec2(surfacePoint.getX(), surfacePoint.getY() + standingHeight);

        Optional<RaycastHit> hit = shapeQueryProvider.raycast(
                rayOrigin, Vec2.DOWN, config.getRayLength(), config.allPlatformLayers());
        if (hit.isEmpty()) {
            return false;
        }

        double hitY = hit.get().getPoint().getY();
        boolean landsOnSurface = Math.abs(hitY - surfacePoint.getY()) <= config.getSurfaceHitTolerance();
        boolean hasHeadroom = (rayOrigin.getY() - hitY) > standingHeight * config.getClearanceRatio();
        return landsOnSurface && hasHeadroom;
    }

    // ========================================================================
    // Post-processing
    // ========================================================================

    /**
     * Merge edges at (nearly) the same height whose ranges touch or overlap.
     *
     * <p>Edges are sorted by height descending, then left ascending. A merge unions the
     * ranges and averages the heights.
     *
     * @param edges     edges to merge; not modified
     * @param threshold maximum height difference, also the allowed gap between ranges
     * @return merged edges in sort order
     */
    public static List<SurfaceEdge> mergeAdjacentEdges(List<SurfaceEdge> edges, double threshold) {
        if (edges.size() <= 1) {
            return new ArrayList<>(edges);
        }

        List<SurfaceEdge> sorted = new ArrayList<>(edges);
        sorted.sort(Comparator.comparingDouble(SurfaceEdge::y).reversed()
                .thenComparingDouble(SurfaceEdge::left));

        List<SurfaceEdge> merged = new ArrayList<>();
        SurfaceEdge current = sorted.get(0);

        for (int i = 1; i < sorted.size(); i++) {
            SurfaceEdge next = sorted.get(i);
            if (Math.abs(current.y() - next.y()) < threshold && next.left() <= current.right() + threshold) {
                current = new SurfaceEdge(
                        Math.min(current.left(), next.left()),
                        Math.max(current.right(), next.right()),
                        (current.y() + next.y()) / 2.0);
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return merged;
    }

    /**
     * Drop edges that overlap a nearby edge horizontally and sit within {@code yThreshold}
     * of it, keeping the higher one.
     *
     * <p>The lower edge of such a pair is an artifact of embedded or overlapping geometry,
     * not a surface a character can reach.
     *
     * @param edges      edges to filter; not modified
     * @param yThreshold maximum height difference for two edges to count as duplicates
     * @return surviving edges, ordered by left end
     */
    public static List<SurfaceEdge> deduplicateCloseEdges(List<SurfaceEdge> edges, double yThreshold) {
        if (edges.size() <= 1) {
            return new ArrayList<>(edges);
        }

        List<SurfaceEdge> sorted = new ArrayList<>(edges);
        sorted.sort(Comparator.comparingDouble(SurfaceEdge::left));

        List<SurfaceEdge> result = new ArrayList<>();
        for (SurfaceEdge edge : sorted) {
            boolean duplicate = false;
            for (int i = 0; i < result.size(); i++) {
                SurfaceEdge existing = result.get(i);
                if (edge.overlapsHorizontally(existing) && Math.abs(edge.y() - existing.y()) < yThreshold) {
                    if (edge.y() > existing.y()) {
                        result.set(i, edge);
                    }
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                result.add(edge);
            }
        }
        return result;
    }
}
