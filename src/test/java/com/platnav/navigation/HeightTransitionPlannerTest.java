package com.platnav.navigation;

import com.platnav.config.PlatformGraphConfig;
import com.platnav.geometry.Vec2;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * Tests for HeightTransitionPlanner take-off and landing nodes.
 */
public class HeightTransitionPlannerTest {

    private static final double EPSILON = 1e-9;

    private HeightTransitionPlanner planner;
    private AtomicInteger ids;

    @Before
    public void setUp() {
        planner = new HeightTransitionPlanner(PlatformGraphConfig.builder().build());
        ids = new AtomicInteger(100);
    }

    private static HeightTransitionPlanner.ShapeEdge edge(double left, double right, double y, int shapeId) {
        return new HeightTransitionPlanner.ShapeEdge(new SurfaceEdge(left, right, y), shapeId, false);
    }

    // ========================================================================
    // Take-off Tests
    // ========================================================================

    @Test
    public void testPlanTransitionNodes_Overhang_AddsTakeOffNodes() {
        List<HeightTransitionPlanner.ShapeEdge> edges = Arrays.asList(
                edge(0, 10, 0, 1),
                edge(4, 6, 3, 2));

        List<PlatformNode> added = planner.planTransitionNodes(edges, Collections.emptyList(), ids::getAndIncrement);

        assertEquals(2, added.size());

        PlatformNode left = added.get(0);
        assertEquals(PlatformNodeType.LEFT_EDGE, left.getType());
        assertEquals(new Vec2(4, 0), left.getPosition());
        assertEquals("Node belongs to the lower surface", 1, left.getShapeId());

        PlatformNode right = added.get(1);
        assertEquals(PlatformNodeType.RIGHT_EDGE, right.getType());
        assertEquals(new Vec2(6, 0), right.getPosition());
        assertEquals(100, left.getId());
        assertEquals(101, right.getId());
    }

    @Test
    public void testPlanTransitionNodes_LowerEndsInside_AddsLandingNodes() {
        // Upper surface covers the lower one's right end
        List<HeightTransitionPlanner.ShapeEdge> edges = Arrays.asList(
                edge(0, 5, 0, 1),
                edge(3, 12, 2, 2));

        List<PlatformNode> added = planner.planTransitionNodes(edges, Collections.emptyList(), ids::getAndIncrement);

        // Upper left end (3) lies over the lower span; lower right end (5) lies under the upper span
        assertEquals(2, added.size());
        assertEquals(new Vec2(3, 0), added.get(0).getPosition());
        assertEquals(1, added.get(0).getShapeId());
        assertEquals(new Vec2(5, 2), added.get(1).getPosition());
        assertEquals(PlatformNodeType.RIGHT_EDGE, added.get(1).getType());
        assertEquals(2, added.get(1).getShapeId());
    }

    // ========================================================================
    // Filter Tests
    // ========================================================================

    @Test
    public void testPlanTransitionNodes_HeightOutsideRange_AddsNothing() {
        List<HeightTransitionPlanner.ShapeEdge> nearlyFlat = Arrays.asList(edge(0, 10, 0, 1), edge(4, 6, 0.2, 2));
        List<HeightTransitionPlanner.ShapeEdge> tooHigh = Arrays.asList(edge(0, 10, 0, 1), edge(4, 6, 9, 2));

        assertTrue(planner.planTransitionNodes(nearlyFlat, Collections.emptyList(), ids::getAndIncrement).isEmpty());
        assertTrue(planner.planTransitionNodes(tooHigh, Collections.emptyList(), ids::getAndIncrement).isEmpty());
    }

    @Test
    public void testPlanTransitionNodes_EndWithinInset_AddsNothing() {
        // Both upper ends sit within the 0.3 inset of the lower surface ends
        List<HeightTransitionPlanner.ShapeEdge> edges = Arrays.asList(edge(0, 10, 0, 1), edge(0.2, 9.8, 3, 2));

        List<PlatformNode> added = planner.planTransitionNodes(edges, Collections.emptyList(), ids::getAndIncrement);

        assertTrue(added.isEmpty());
    }

    @Test
    public void testPlanTransitionNodes_ExistingNodeNearby_Skipped() {
        List<HeightTransitionPlanner.ShapeEdge> edges = Arrays.asList(edge(0, 10, 0, 1), edge(4, 6, 3, 2));
        List<PlatformNode> existing = new ArrayList<>();
        existing.add(PlatformNode.surface(0, new Vec2(4.1, 0), 1, false));

        List<PlatformNode> added = planner.planTransitionNodes(edges, existing, ids::getAndIncrement);

        assertEquals("Only the right end is still uncovered", 1, added.size());
        assertEquals(6, added.get(0).getPosition().getX(), EPSILON);
        assertEquals("Existing nodes are not modified", 1, existing.size());
    }

    @Test
    public void testPlanTransitionNodes_SingleEdge_AddsNothing() {
        assertTrue(planner.planTransitionNodes(
                Collections.singletonList(edge(0, 10, 0, 1)), Collections.emptyList(), ids::getAndIncrement).isEmpty());
    }
}
