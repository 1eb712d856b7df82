package com.platnav.navigation;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.platnav.config.PlatformGraphConfig;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Connects nodes that stand on the same surface with bidirectional walk links.
 *
 * <p>Nodes are grouped by source shape and quantized height ({@code round(y / maxWalkYDiff)}),
 * sorted by X within each group, and only neighbours in that order are linked. The result
 * per surface is a chain, never a clique. A neighbour pair further apart than
 * {@code maxWalkXGap} horizontally or {@code maxWalkYDiff} vertically stays unlinked, which
 * keeps two disjoint loops of one shape from being walked across their gap.
 */
@Slf4j
public class WalkLinkBuilder {

    private final double maxYDiff;
    private final double maxXGap;

    public WalkLinkBuilder(PlatformGraphConfig config) {
        this(config.getMaxWalkYDiff(), config.getMaxWalkXGap());
    }

    public WalkLinkBuilder(double maxYDiff, double maxXGap) {
        this.maxYDiff = maxYDiff;
        this.maxXGap = maxXGap;
    }

    /**
     * Build the walk links for a set of nodes.
     *
     * @param nodes all nodes of the graph
     * @return links in pairs (forward then reverse), each pair sharing one cost
     */
    public List<PlatformLink> buildWalkLinks(List<PlatformNode> nodes) {
        ListMultimap<SurfaceKey, PlatformNode> groups = MultimapBuilder.linkedHashKeys().arrayListValues().build();
        for (PlatformNode node : nodes) {
            if (node == null) {
                continue;
            }
            long heightBucket = Math.round(node.getPosition().getY() / maxYDiff);
            groups.put(new SurfaceKey(node.getShapeId(), heightBucket), node);
        }

        List<PlatformLink> links = new ArrayList<>();
        int rejected = 0;

        for (SurfaceKey key : groups.keySet()) {
            Collection<PlatformNode> group = groups.get(key);
            if (group.size() < 2) {
                continue;
            }

            List<PlatformNode> sorted = new ArrayList<>(group);
            sorted.sort(Comparator.comparingDouble(n -> n.getPosition().getX()));

            for (int i = 0; i < sorted.size() - 1; i++) {
                PlatformNode from = sorted.get(i);
                PlatformNode to = sorted.get(i + 1);

                double xGap = Math.abs(to.getPosition().getX() - from.getPosition().getX());
                double yDiff = Math.abs(to.getPosition().getY() - from.getPosition().getY());
                if (xGap > maxXGap || yDiff > maxYDiff) {
                    rejected++;
                    continue;
                }

                double distance = from.distanceTo(to);
                links.add(PlatformLink.walk(from.getId(), to.getId(), distance));
                links.add(PlatformLink.walk(to.getId(), from.getId(), distance));
            }
        }

        log.debug("Built {} walk links over {} surface groups ({} neighbour pairs too far apart)",
                links.size(), groups.keySet().size(), rejected);
        return links;
    }

    /**
     * Grouping key: one shape at one quantized height.
     */
    @Value
    private static class SurfaceKey {
        int shapeId;
        long heightBucket;
    }
}
