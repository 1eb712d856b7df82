package com.platnav.navigation;

import lombok.Builder;
import lombok.Value;

/**
 * A directed traversal edge between two nodes.
 */
@Value
@Builder(toBuilder = true)
public class PlatformLink {

    /**
     * Assumed walking speed, in units per second, used to estimate walk durations.
     */
    public static final double WALK_SPEED = 5.0;

    int fromId;

    int toId;

    PlatformLinkType type;

    /**
     * Pathfinding weight. Never negative; Euclidean distance for walk links.
     */
    double cost;

    /**
     * Estimated traversal time in seconds.
     */
    double duration;

    /**
     * True if the link cannot be traversed backwards. Walk links are always reversible.
     */
    boolean oneWay;

    /**
     * Initial horizontal velocity of a jump. 0 for other link types.
     */
    double jumpVelocityX;

    /**
     * Initial vertical velocity of a jump. 0 for other link types.
     */
    double jumpVelocityY;

    /**
     * Create a walk link. Cost is the distance walked.
     */
    public static PlatformLink walk(int fromId, int toId, double distance) {
        return PlatformLink.builder()
                .fromId(fromId)
                .toId(toId)
                .type(PlatformLinkType.WALK)
                .cost(distance)
                .duration(distance / WALK_SPEED)
                .oneWay(false)
                .build();
    }

    /**
     * Create a jump link. Jumps cost twice their airtime.
     */
    public static PlatformLink jump(int fromId, int toId, double velocityX, double velocityY, double duration) {
        return PlatformLink.builder()
                .fromId(fromId)
                .toId(toId)
                .type(PlatformLinkType.JUMP)
                .cost(duration * 2)
                .duration(duration)
                .oneWay(true)
                .jumpVelocityX(velocityX)
                .jumpVelocityY(velocityY)
                .build();
    }

    /**
     * Create a fall link.
     */
    public static PlatformLink fall(int fromId, int toId, double duration) {
        return PlatformLink.builder()
                .fromId(fromId)
                .toId(toId)
                .type(PlatformLinkType.FALL)
                .cost(duration * 1.5)
                .duration(duration)
                .oneWay(true)
                .build();
    }

    /**
     * Create a drop-through link for one-way platforms.
     */
    public static PlatformLink dropThrough(int fromId, int toId, double duration) {
        return PlatformLink.builder()
                .fromId(fromId)
                .toId(toId)
                .type(PlatformLinkType.DROP_THROUGH)
                .cost(duration * 1.5)
                .duration(duration)
                .oneWay(true)
                .build();
    }

    @Override
    public String toString() {
        return String.format("PlatformLink[%d -> %d, %s, cost %.2f]", fromId, toId, type, cost);
    }
}
