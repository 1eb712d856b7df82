package com.platnav.navigation;

import com.platnav.config.PlatformGraphConfig;
import com.platnav.geometry.Vec2;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Tests for WalkLinkBuilder grouping and neighbour linking.
 */
public class WalkLinkBuilderTest {

    private static final double EPSILON = 1e-9;

    private WalkLinkBuilder builder;

    @Before
    public void setUp() {
        builder = new WalkLinkBuilder(PlatformGraphConfig.builder().build());
    }

    private static PlatformNode node(int id, double x, double y, int shapeId) {
        return PlatformNode.surface(id, new Vec2(x, y), shapeId, false);
    }

    private static boolean hasLink(List<PlatformLink> links, int from, int to) {
        for (PlatformLink link : links) {
            if (link.getFromId() == from && link.getToId() == to) {
                return true;
            }
        }
        return false;
    }

    // ========================================================================
    // Chain Tests
    // ========================================================================

    @Test
    public void testBuildWalkLinks_EightNodes_SevenBidirectionalPairs() {
        List<PlatformNode> nodes = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            nodes.add(node(i, 0.3 + i * 1.3, 0, 1));
        }

        List<PlatformLink> links = builder.buildWalkLinks(nodes);

        assertEquals(14, links.size());
        for (int i = 0; i < 7; i++) {
            assertTrue("Forward link " + i, hasLink(links, i, i + 1));
            assertTrue("Reverse link " + i, hasLink(links, i + 1, i));
        }
        assertFalse("Only neighbours are linked", hasLink(links, 0, 2));
    }

    @Test
    public void testBuildWalkLinks_ShuffledInput_FollowsXOrder() {
        List<PlatformNode> nodes = Arrays.asList(node(0, 5, 0, 1), node(1, 1, 0, 1), node(2, 3, 0, 1));

        List<PlatformLink> links = builder.buildWalkLinks(nodes);

        assertEquals(4, links.size());
        assertTrue(hasLink(links, 1, 2));
        assertTrue(hasLink(links, 2, 0));
        assertFalse(hasLink(links, 1, 0));
    }

    @Test
    public void testBuildWalkLinks_AnyPair_SymmetricEqualCost() {
        List<PlatformNode> nodes = Arrays.asList(node(0, 0, 0, 1), node(1, 1.5, 0.2, 1), node(2, 3, 0, 1));

        List<PlatformLink> links = builder.buildWalkLinks(nodes);

        for (PlatformLink link : links) {
            assertEquals(PlatformLinkType.WALK, link.getType());
            assertFalse("Walk links are reversible", link.isOneWay());
            PlatformLink reverse = links.stream()
                    .filter(l -> l.getFromId() == link.getToId() && l.getToId() == link.getFromId())
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("Missing reverse of " + link));
            assertEquals(link.getCost(), reverse.getCost(), 0.0);
        }
    }

    @Test
    public void testBuildWalkLinks_Cost_IsEuclideanDistance() {
        List<PlatformLink> links = builder.buildWalkLinks(Arrays.asList(node(0, 0, 0, 1), node(1, 0.15, 0.2, 1)));

        assertEquals(2, links.size());
        assertEquals(0.25, links.get(0).getCost(), EPSILON);
        assertEquals("Duration assumes walking speed", 0.25 / PlatformLink.WALK_SPEED, links.get(0).getDuration(), EPSILON);
    }

    // ========================================================================
    // Separation Tests
    // ========================================================================

    @Test
    public void testBuildWalkLinks_GapBeyondMax_NotLinked() {
        List<PlatformNode> nodes = Arrays.asList(node(0, 0, 0, 1), node(1, 5, 0, 1));

        assertTrue(builder.buildWalkLinks(nodes).isEmpty());
    }

    @Test
    public void testBuildWalkLinks_GapAtMax_Linked() {
        List<PlatformNode> nodes = Arrays.asList(node(0, 0, 0, 1), node(1, 3, 0, 1));

        assertEquals("Bound is inclusive", 2, builder.buildWalkLinks(nodes).size());
    }

    @Test
    public void testBuildWalkLinks_DifferentShapes_NotLinked() {
        List<PlatformNode> nodes = Arrays.asList(node(0, 0, 0, 1), node(1, 1, 0, 2));

        assertTrue(builder.buildWalkLinks(nodes).isEmpty());
    }

    @Test
    public void testBuildWalkLinks_DifferentHeights_NotLinked() {
        List<PlatformNode> nodes = Arrays.asList(node(0, 0, 0, 1), node(1, 1, 2, 1));

        assertTrue(builder.buildWalkLinks(nodes).isEmpty());
    }

    @Test
    public void testBuildWalkLinks_CustomBounds_Applied() {
        WalkLinkBuilder wide = new WalkLinkBuilder(0.5, 6.0);

        assertEquals(2, wide.buildWalkLinks(Arrays.asList(node(0, 0, 0, 1), node(1, 5, 0, 1))).size());
    }

    @Test
    public void testBuildWalkLinks_EmptyOrSingle_ReturnsNoLinks() {
        assertTrue(builder.buildWalkLinks(Collections.emptyList()).isEmpty());
        assertTrue(builder.buildWalkLinks(Collections.singletonList(node(0, 0, 0, 1))).isEmpty());
    }
}
