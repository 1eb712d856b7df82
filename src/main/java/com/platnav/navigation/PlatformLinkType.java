package com.platnav.navigation;

/**
 * Types of links in the platform graph.
 *
 * <p>Generation only produces {@link #WALK} links. The other types are added later
 * through {@link PlatformGraphGenerator#addLink} by the movement solvers that know the
 * character's jump and fall capabilities.
 */
public enum PlatformLinkType {
    /**
     * Walking along the same surface. Always reversible.
     */
    WALK,

    /**
     * Jumping to another surface.
     */
    JUMP,

    /**
     * Walking off an edge and falling.
     */
    FALL,

    /**
     * Dropping down through a one-way platform.
     */
    DROP_THROUGH
}
