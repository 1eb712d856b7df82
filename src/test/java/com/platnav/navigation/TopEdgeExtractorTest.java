package com.platnav.navigation;

import com.google.common.collect.ImmutableList;
import com.platnav.config.PlatformGraphConfig;
import com.platnav.geometry.BoxShape;
import com.platnav.geometry.PolygonShape;
import com.platnav.geometry.RaycastHit;
import com.platnav.geometry.ShapeQueryProvider;
import com.platnav.geometry.StaticShape;
import com.platnav.geometry.StaticShapeWorld;
import com.platnav.geometry.Vec2;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for TopEdgeExtractor edge detection, raycast verification and post-processing.
 */
public class TopEdgeExtractorTest {

    private static final double EPSILON = 1e-9;

    @Mock
    private ShapeQueryProvider shapeQueryProvider;

    @Mock
    private StaticShape hitShape;

    private PlatformGraphConfig config;
    private TopEdgeExtractor extractor;

    @Before
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        config = PlatformGraphConfig.builder().build();
        extractor = new TopEdgeExtractor(shapeQueryProvider, config);
    }

    /**
     * Make every downward ray land at a fixed height.
     */
    private void stubGroundAt(double y) {
        when(shapeQueryProvider.raycast(any(Vec2.class), eq(Vec2.DOWN), anyDouble(), anyInt()))
                .thenAnswer(invocation -> {
                    Vec2 origin = invocation.getArgument(0);
                    if (origin.getY() < y) {
                        return Optional.of(new RaycastHit(origin, hitShape, 0));
                    }
                    double maxDistance = invocation.getArgument(2);
                    double distance = origin.getY() - y;
                    if (distance > maxDistance) {
                        return Optional.empty();
                    }
                    return Optional.of(new RaycastHit(new Vec2(origin.getX(), y), hitShape, distance));
                });
    }

    // ========================================================================
    // Candidate Filtering Tests
    // ========================================================================

    @Test
    public void testFindTopEdges_FewerThanThreePoints_ReturnsEmpty() {
        List<SurfaceEdge> edges = extractor.findTopEdges(Arrays.asList(new Vec2(0, 0), new Vec2(10, 0)));

        assertTrue("Degenerate path should produce no edges", edges.isEmpty());
        verifyNoInteractions(shapeQueryProvider);
    }

    @Test
    public void testFindTopEdges_NullPath_ReturnsEmpty() {
        assertTrue(extractor.findTopEdges(null).isEmpty());
    }

    @Test
    public void testFindTopEdges_SteepEdge_SkippedWithoutRaycast() {
        // Triangle whose only non-vertical edges are steeper than the threshold
        List<Vec2> spike = Arrays.asList(new Vec2(0, 0), new Vec2(1, 5), new Vec2(2, 0));
        stubGroundAt(0);

        List<SurfaceEdge> edges = extractor.findTopEdges(spike);

        // Only the flat base (0..2 at y=0) is a candidate, and it verifies against the stubbed ground
        assertEquals(1, edges.size());
        verify(shapeQueryProvider, times(1)).raycast(any(Vec2.class), eq(Vec2.DOWN), anyDouble(), anyInt());
    }

    @Test
    public void testFindTopEdges_GentleRamp_Accepted() {
        // Slope 0.4 is below the 0.5 threshold
        List<Vec2> ramp = Arrays.asList(new Vec2(0, -1), new Vec2(10, -1), new Vec2(10, 4), new Vec2(0, 0));
        StaticShapeWorld world = new StaticShapeWorld()
                .addShape(new PolygonShape(1, 0, ImmutableList.of(ramp)));
        TopEdgeExtractor worldExtractor = new TopEdgeExtractor(world, config);

        List<SurfaceEdge> edges = worldExtractor.findTopEdges(ramp);

        assertEquals("Only the ramp surface should be accepted", 1, edges.size());
        assertEquals(0, edges.get(0).left(), EPSILON);
        assertEquals(10, edges.get(0).right(), EPSILON);
        assertEquals("Ramp height is its midpoint", 2, edges.get(0).y(), EPSILON);
    }

    @Test
    public void testFindTopEdges_Raycast_UsesConfiguredRayAndLayers() {
        stubGroundAt(0);

        extractor.findTopEdges(Arrays.asList(new Vec2(0, -1), new Vec2(10, -1), new Vec2(10, 0), new Vec2(0, 0)));

        verify(shapeQueryProvider, atLeastOnce()).raycast(
                eq(new Vec2(5, 1)), eq(Vec2.DOWN), eq(config.getRayLength()), eq(config.allPlatformLayers()));
    }

    // ========================================================================
    // Raycast Verification Tests
    // ========================================================================

    @Test
    public void testFindTopEdges_Box_TopAcceptedBottomRejected() {
        BoxShape box = BoxShape.fromMinMax(1, 0, 0, -1, 10, 0);
        TopEdgeExtractor worldExtractor = new TopEdgeExtractor(new StaticShapeWorld().addShape(box), config);

        List<SurfaceEdge> edges = worldExtractor.findTopEdges(box.getPaths().get(0));

        assertEquals("Only the top edge is walkable", 1, edges.size());
        SurfaceEdge top = edges.get(0);
        assertEquals(0, top.left(), EPSILON);
        assertEquals(10, top.right(), EPSILON);
        assertEquals(0, top.y(), EPSILON);
    }

    @Test
    public void testFindTopEdges_RayMiss_Rejected() {
        when(shapeQueryProvider.raycast(any(Vec2.class), any(Vec2.class), anyDouble(), anyInt()))
                .thenReturn(Optional.empty());

        List<SurfaceEdge> edges = extractor.findTopEdges(
                Arrays.asList(new Vec2(0, 0), new Vec2(10, 0), new Vec2(10, 1), new Vec2(0, 1)));

        assertTrue(edges.isEmpty());
    }

    @Test
    public void testFindTopEdges_LowCeiling_Rejected() {
        // Something 0.5 above the surface is hit first: wrong height and no headroom
        stubGroundAt(0.5);

        List<SurfaceEdge> edges = extractor.findTopEdges(
                Arrays.asList(new Vec2(0, -1), new Vec2(10, -1), new Vec2(10, 0), new Vec2(0, 0)));

        assertTrue("Buried surface should be rejected", edges.isEmpty());
    }

    @Test
    public void testFindTopEdges_HitWithinTolerance_Accepted() {
        stubGroundAt(0.15);

        List<SurfaceEdge> edges = extractor.findTopEdges(
                Arrays.asList(new Vec2(0, -1), new Vec2(10, -1), new Vec2(10, 0), new Vec2(0, 0)));

        assertEquals(1, edges.size());
        assertEquals("Edge height is the midpoint, not the hit point", 0, edges.get(0).y(), EPSILON);
    }

    // ========================================================================
    // Post-processing Tests
    // ========================================================================

    @Test
    public void testMergeAdjacentEdges_TouchingSameHeight_Merged() {
        List<SurfaceEdge> merged = TopEdgeExtractor.mergeAdjacentEdges(Arrays.asList(
                new SurfaceEdge(5, 10, 1.04),
                new SurfaceEdge(0, 5.05, 1.0)), 0.1);

        assertEquals(1, merged.size());
        assertEquals(0, merged.get(0).left(), EPSILON);
        assertEquals(10, merged.get(0).right(), EPSILON);
        assertEquals("Merged height is the average", 1.02, merged.get(0).y(), EPSILON);
    }

    @Test
    public void testMergeAdjacentEdges_Gapped_KeptApart() {
        List<SurfaceEdge> merged = TopEdgeExtractor.mergeAdjacentEdges(Arrays.asList(
                new SurfaceEdge(0, 4, 0),
                new SurfaceEdge(9, 13, 0)), 0.1);

        assertEquals(2, merged.size());
    }

    @Test
    public void testMergeAdjacentEdges_DifferentHeights_KeptApart() {
        List<SurfaceEdge> merged = TopEdgeExtractor.mergeAdjacentEdges(Arrays.asList(
                new SurfaceEdge(0, 5, 0),
                new SurfaceEdge(3, 8, 0.3)), 0.1);

        assertEquals(2, merged.size());
        assertEquals("Sorted by height descending", 0.3, merged.get(0).y(), EPSILON);
    }

    @Test
    public void testDeduplicateCloseEdges_Overlapping_KeepsHigher() {
        List<SurfaceEdge> deduped = TopEdgeExtractor.deduplicateCloseEdges(Arrays.asList(
                new SurfaceEdge(0, 5, 2.0),
                new SurfaceEdge(1, 4, 2.3)), 0.5);

        assertEquals(1, deduped.size());
        assertEquals(new SurfaceEdge(1, 4, 2.3), deduped.get(0));
    }

    @Test
    public void testDeduplicateCloseEdges_DistantHeights_KeepsBoth() {
        List<SurfaceEdge> deduped = TopEdgeExtractor.deduplicateCloseEdges(Arrays.asList(
                new SurfaceEdge(0, 5, 0),
                new SurfaceEdge(1, 4, 3)), 0.5);

        assertEquals("Edges 3 units apart are separate floors", 2, deduped.size());
    }

    @Test
    public void testDeduplicateCloseEdges_Touching_KeepsBoth() {
        List<SurfaceEdge> deduped = TopEdgeExtractor.deduplicateCloseEdges(Arrays.asList(
                new SurfaceEdge(0, 5, 0),
                new SurfaceEdge(5, 9, 0.2)), 0.5);

        assertEquals(2, deduped.size());
    }

    @Test
    public void testExtractTopEdges_MultiplePaths_PostProcessedTogether() {
        stubGroundAt(0);
        List<Vec2> left = Arrays.asList(new Vec2(0, -1), new Vec2(5, -1), new Vec2(5, 0), new Vec2(0, 0));
        List<Vec2> right = Arrays.asList(new Vec2(5, -1), new Vec2(10, -1), new Vec2(10, 0), new Vec2(5, 0));

        List<SurfaceEdge> edges = extractor.extractTopEdges(ImmutableList.of(left, right));

        assertEquals("Touching tops of two loops should merge", 1, edges.size());
        assertEquals(0, edges.get(0).left(), EPSILON);
        assertEquals(10, edges.get(0).right(), EPSILON);
    }
}
