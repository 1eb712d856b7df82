package com.platnav.navigation;

/**
 * Lifecycle of a {@link PlatformGraphGenerator}.
 */
public enum GraphState {
    NOT_GENERATED,
    GENERATING,
    GENERATED
}
