package com.platnav.navigation;

import com.google.common.collect.ImmutableList;
import com.platnav.config.PlatformGraphConfig;
import com.platnav.geometry.Region;
import com.platnav.geometry.ShapeQueryProvider;
import com.platnav.geometry.StaticShape;
import com.platnav.geometry.Vec2;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the platform navigation graph of a region and answers spatial queries over it.
 *
 * <p>Generation runs in one blocking call:
 * <ol>
 *   <li>query the static shapes overlapping the region on the platform layers</li>
 *   <li>extract the walkable top edges of each shape ({@link TopEdgeExtractor})</li>
 *   <li>place nodes along each edge ({@link NodePlacer})</li>
 *   <li>optionally add nodes where surfaces overlap at different heights
 *       ({@link HeightTransitionPlanner})</li>
 *   <li>connect same-surface neighbours with walk links ({@link WalkLinkBuilder})</li>
 *   <li>index the nodes ({@link NodeSpatialGrid})</li>
 * </ol>
 *
 * <p>The graph is replaced as a whole on every generation. Only walk links are produced
 * here; movement solvers add jump, fall and drop-through links afterwards through
 * {@link #addLink}.
 *
 * <p>Not thread-safe. Generation must run on the thread that owns the
 * {@link ShapeQueryProvider}. Read queries may run concurrently once generation has
 * completed, as long as no {@link #generate}, {@link #clear} or {@link #addLink} is in
 * flight.
 */
@Slf4j
@Singleton
public class PlatformGraphGenerator {

    private final ShapeQueryProvider shapeQueryProvider;
    private final PlatformGraphConfig config;

    private final TopEdgeExtractor edgeExtractor;
    private final NodePlacer nodePlacer;
    private final WalkLinkBuilder walkLinkBuilder;
    private final HeightTransitionPlanner transitionPlanner;
    private final NodeSpatialGrid spatialGrid;

    private final List<PlatformNode> nodes = new ArrayList<>();
    private final List<PlatformLink> links = new ArrayList<>();

    /**
     * Node ID -> index into {@link #nodes}.
     */
    private final Map<Integer, Integer> nodeIndexById = new HashMap<>();

    private int nextNodeId = 0;
    private GraphState state = GraphState.NOT_GENERATED;
    private Region lastGeneratedRegion;

    @Inject
    public PlatformGraphGenerator(ShapeQueryProvider shapeQueryProvider, PlatformGraphConfig config) {
        this.shapeQueryProvider = shapeQueryProvider;
        this.config = config.validate();

        this.edgeExtractor = new TopEdgeExtractor(shapeQueryProvider, config);
        this.nodePlacer = new NodePlacer(config);
        this.walkLinkBuilder = new WalkLinkBuilder(config);
        this.transitionPlanner = new HeightTransitionPlanner(config);
        this.spatialGrid = new NodeSpatialGrid(config.getSpatialGridCellSize());

        if (config.getSpatialGridCellSize() < config.actualNodeSpacing()) {
            log.warn("Spatial grid cell size {} is smaller than the node spacing {}; most cells will be empty",
                    config.getSpatialGridCellSize(), config.actualNodeSpacing());
        }
    }

    // ========================================================================
    // Generation
    // ========================================================================

    /**
     * Generate the graph for the configured scan region.
     */
    public void generate() {
        generate(config.scanRegion());
    }

    /**
     * Generate the graph for a region, replacing any previous graph.
     *
     * @param region area to scan for static shapes
     */
    public void generate(Region region) {
        clear();
        state = GraphState.GENERATING;

        try {
            List<StaticShape> shapes = shapeQueryProvider.overlapBox(
                    region.getCenter(), region.getSize(), config.allPlatformLayers());
            if (shapes == null) {
                shapes = Collections.emptyList();
            }

            List<HeightTransitionPlanner.ShapeEdge> allEdges = new ArrayList<>();
            int processed = 0;
            for (StaticShape shape : shapes) {
                if (shape == null) {
                    log.debug("Skipping null shape handle");
                    continue;
                }
                if (processShape(shape, allEdges)) {
                    processed++;
                }
            }

            if (config.isGenerateHeightTransitionNodes()) {
                addNodes(transitionPlanner.planTransitionNodes(allEdges, nodes, this::nextId));
            }

            links.addAll(walkLinkBuilder.buildWalkLinks(nodes));

            if (!nodes.isEmpty()) {
                spatialGrid.build(nodes);
            }

            lastGeneratedRegion = region;
            state = GraphState.GENERATED;

            log.info("Platform graph generated for {}: {} shapes ({} with surfaces), {} edges, {} nodes, {} links",
                    region, shapes.size(), processed, allEdges.size(), nodes.size(), links.size());
        } catch (RuntimeException e) {
            log.error("Platform graph generation failed for {}", region, e);
            clear();
            throw e;
        }
    }

    /**
     * Extract the surfaces of one shape and place their nodes.
     *
     * @return true if the shape contributed at least one edge
     */
    private boolean processShape(StaticShape shape, List<HeightTransitionPlanner.ShapeEdge> allEdges) {
        if (shape.getKind() == null) {
            log.debug("Skipping shape {} with no kind", shape.getId());
            return false;
        }

        boolean oneWay = shape.isOnLayer(config.getOneWayPlatformLayerMask());
        List<SurfaceEdge> edges;

        switch (shape.getKind()) {
            case BOX:
            case POLYGON:
                edges = edgeExtractor.extractTopEdges(usablePaths(shape));
                break;
            case POLYLINE:
                edges = polylineEdge(shape);
                break;
            default:
                log.debug("Skipping shape {} of unsupported kind {}", shape.getId(), shape.getKind());
                return false;
        }

        for (SurfaceEdge edge : edges) {
            addNodes(nodePlacer.placeNodes(edge, shape.getId(), oneWay, this::nextId));
            allEdges.add(new HeightTransitionPlanner.ShapeEdge(edge, shape.getId(), oneWay));
        }

        if (edges.isEmpty()) {
            log.debug("Shape {} ({}) has no walkable surface", shape.getId(), shape.getKind());
        }
        return !edges.isEmpty();
    }

    private List<List<Vec2>> usablePaths(StaticShape shape) {
        List<List<Vec2>> paths = shape.getPaths();
        if (paths == null) {
            return Collections.emptyList();
        }
        List<List<Vec2>> usable = new ArrayList<>(paths.size());
        for (List<Vec2> path : paths) {
            if (path == null || path.size() < 2) {
                log.debug("Skipping degenerate path of shape {}", shape.getId());
                continue;
            }
            usable.add(path);
        }
        return usable;
    }

    /**
     * A polyline is treated as a simple platform spanning the top of its bounds.
     */
    private List<SurfaceEdge> polylineEdge(StaticShape shape) {
        Region bounds = shape.getBounds();
        if (bounds == null || bounds.getSize().getX() < config.getMinEdgeSpan()) {
            return Collections.emptyList();
        }
        return Collections.singletonList(new SurfaceEdge(bounds.getMinX(), bounds.getMaxX(), bounds.getMaxY()));
    }

    private int nextId() {
        return nextNodeId++;
    }

    private void addNodes(List<PlatformNode> placed) {
        for (PlatformNode node : placed) {
            nodeIndexById.put(node.getId(), nodes.size());
            nodes.add(node);
        }
    }

    /**
     * Discard the graph and reset the node ID counter.
     */
    public void clear() {
        boolean hadGraph = !nodes.isEmpty() || !links.isEmpty();

        nodes.clear();
        links.clear();
        nodeIndexById.clear();
        spatialGrid.clear();
        nextNodeId = 0;
        state = GraphState.NOT_GENERATED;
        lastGeneratedRegion = null;

        if (hadGraph) {
            log.info("Platform graph cleared");
        }
    }

    // ========================================================================
    // Node Queries
    // ========================================================================

    /**
     * Get a node by ID.
     *
     * @param id node ID
     * @return the node, or empty if no such node exists
     */
    public Optional<PlatformNode> getNode(int id) {
        Integer index = nodeIndexById.get(id);
        return index != null ? Optional.of(nodes.get(index)) : Optional.empty();
    }

    /**
     * Find the node closest to a position, at any distance.
     */
    public Optional<PlatformNode> findNearestNode(Vec2 position) {
        return findNearestNode(position, Double.MAX_VALUE);
    }

    /**
     * Find the node closest to a position.
     *
     * @param position    query position
     * @param maxDistance only nodes strictly closer than this are considered
     * @return the nearest node, or empty if none is in range or the graph is not generated
     */
    public Optional<PlatformNode> findNearestNode(Vec2 position, double maxDistance) {
        if (state != GraphState.GENERATED) {
            return Optional.empty();
        }
        if (spatialGrid.isBuilt()) {
            return spatialGrid.findNearest(position, maxDistance);
        }
        return NodeSpatialGrid.findNearestLinear(nodes, position, maxDistance);
    }

    /**
     * Find the node closest to a position, preferring the nodes of one shape.
     *
     * <p>Falls back to {@link #findNearestNode(Vec2, double)} when that shape has no node
     * within {@code maxDistance}.
     *
     * @param position    query position
     * @param shapeId     preferred shape
     * @param maxDistance only nodes strictly closer than this are considered
     */
    public Optional<PlatformNode> findNearestNodeOnPlatform(Vec2 position, int shapeId, double maxDistance) {
        if (state != GraphState.GENERATED) {
            return Optional.empty();
        }

        PlatformNode nearest = null;
        double nearestDistSq = maxDistance * maxDistance;
        for (PlatformNode node : nodes) {
            if (node.getShapeId() != shapeId) {
                continue;
            }
            double distSq = position.distanceSquaredTo(node.getPosition());
            if (distSq < nearestDistSq) {
                nearestDistSq = distSq;
                nearest = node;
            }
        }

        if (nearest != null) {
            return Optional.of(nearest);
        }
        return findNearestNode(position, maxDistance);
    }

    /**
     * Find all nodes within a radius (inclusive).
     *
     * @return a new list of matching nodes
     */
    public List<PlatformNode> findNodesInRange(Vec2 position, double radius) {
        List<PlatformNode> results = new ArrayList<>();
        findNodesInRange(position, radius, results);
        return results;
    }

    /**
     * Find all nodes within a radius (inclusive) without allocating.
     *
     * @param results output buffer, cleared before use
     */
    public void findNodesInRange(Vec2 position, double radius, List<PlatformNode> results) {
        if (state != GraphState.GENERATED) {
            results.clear();
            return;
        }
        if (spatialGrid.isBuilt()) {
            spatialGrid.findNodesInRange(position, radius, results);
        } else {
            NodeSpatialGrid.findNodesInRangeLinear(nodes, position, radius, results);
        }
    }

    /**
     * @return immutable snapshot of all nodes in generation order
     */
    public List<PlatformNode> getNodes() {
        return ImmutableList.copyOf(nodes);
    }

    public int getNodeCount() {
        return nodes.size();
    }

    // ========================================================================
    // Link Queries
    // ========================================================================

    /**
     * Get the links leaving a node.
     *
     * @param nodeId source node ID
     * @return matching links, empty if the node has none or does not exist
     */
    public List<PlatformLink> getOutgoingLinks(int nodeId) {
        List<PlatformLink> outgoing = new ArrayList<>();
        for (PlatformLink link : links) {
            if (link.getFromId() == nodeId) {
                outgoing.add(link);
            }
        }
        return outgoing;
    }

    /**
     * Append a link to the generated graph.
     *
     * <p>Used by movement solvers to add jump, fall and drop-through links.
     *
     * @param link the link to add
     * @throws IllegalStateException    if the graph is not generated
     * @throws IllegalArgumentException if an endpoint does not exist or the cost is negative
     */
    public void addLink(PlatformLink link) {
        if (state != GraphState.GENERATED) {
            throw new IllegalStateException("Cannot add links to a graph in state " + state);
        }
        if (link == null) {
            throw new IllegalArgumentException("Link must not be null");
        }
        if (!nodeIndexById.containsKey(link.getFromId())) {
            throw new IllegalArgumentException("Unknown source node " + link.getFromId() + " in " + link);
        }
        if (!nodeIndexById.containsKey(link.getToId())) {
            throw new IllegalArgumentException("Unknown target node " + link.getToId() + " in " + link);
        }
        if (!(link.getCost() >= 0)) {
            throw new IllegalArgumentException("Link cost must be non-negative, was " + link.getCost());
        }
        links.add(link);
    }

    /**
     * @return immutable snapshot of all links
     */
    public List<PlatformLink> getLinks() {
        return ImmutableList.copyOf(links);
    }

    public int getLinkCount() {
        return links.size();
    }

    // ========================================================================
    // State
    // ========================================================================

    public GraphState getState() {
        return state;
    }

    public boolean isGenerated() {
        return state == GraphState.GENERATED;
    }

    /**
     * @return the region of the last completed generation, or empty if none
     */
    public Optional<Region> getLastGeneratedRegion() {
        return Optional.ofNullable(lastGeneratedRegion);
    }

    public PlatformGraphConfig getConfig() {
        return config;
    }

    /**
     * Get statistics for monitoring.
     *
     * @return formatted statistics string
     */
    public String getStats() {
        return String.format("PlatformGraph[state=%s, nodes=%d, links=%d, %s]",
                state, nodes.size(), links.size(), spatialGrid.getStats());
    }
}
