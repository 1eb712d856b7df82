package com.platnav.navigation;

/**
 * Types of nodes in the platform graph.
 */
public enum PlatformNodeType {
    /**
     * Ordinary point on a walkable surface.
     */
    SURFACE,

    /**
     * Left end of a surface. Take-off and landing point for jumps and falls.
     */
    LEFT_EDGE,

    /**
     * Right end of a surface.
     */
    RIGHT_EDGE,

    /**
     * Point on a surface that can be dropped through.
     */
    ONE_WAY
}
