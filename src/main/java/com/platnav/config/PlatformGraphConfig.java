package com.platnav.config;

import com.platnav.geometry.Region;
import com.platnav.geometry.Vec2;
import lombok.Builder;
import lombok.Value;

/**
 * Configuration for platform graph generation.
 *
 * <p>Immutable. Build with {@link #builder()}; every option has a default suited to a
 * character roughly 1.8 units tall. Call {@link #validate()} (the generator does) to reject
 * broken values before any generation runs.
 *
 * <p>Option groups:
 * <ul>
 *   <li>Scan region: {@code scanCenter}, {@code scanSize}</li>
 *   <li>Node placement: {@code nodeSpacing}, {@code denseNodeSpacing}, {@code useDenseNodes},
 *       {@code edgeInset}, {@code minPlatformWidth}</li>
 *   <li>Spatial index: {@code spatialGridCellSize}</li>
 *   <li>Layers: {@code groundLayerMask}, {@code oneWayPlatformLayerMask}, {@code obstacleLayerMask}</li>
 *   <li>Top edge detection: slope, span, raycast and merge/dedup thresholds</li>
 *   <li>Walk links: {@code maxWalkYDiff}, {@code maxWalkXGap}</li>
 *   <li>Height transition nodes (off by default)</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class PlatformGraphConfig {

    // Scan region

    @Builder.Default
    Vec2 scanCenter = Vec2.ZERO;

    @Builder.Default
    Vec2 scanSize = new Vec2(100, 50);

    // Node placement

    /**
     * Interior node spacing along a surface.
     */
    @Builder.Default
    double nodeSpacing = 1.5;

    /**
     * Interior node spacing used when {@link #useDenseNodes} is set.
     */
    @Builder.Default
    double denseNodeSpacing = 0.75;

    @Builder.Default
    boolean useDenseNodes = false;

    /**
     * Inward offset of the edge nodes from the surface ends.
     */
    @Builder.Default
    double edgeInset = 0.3;

    /**
     * Surfaces narrower than this get a single center node.
     */
    @Builder.Default
    double minPlatformWidth = 1.0;

    // Spatial index

    @Builder.Default
    double spatialGridCellSize = 3.0;

    // Layers

    @Builder.Default
    int groundLayerMask = 1;

    @Builder.Default
    int oneWayPlatformLayerMask = 0;

    /**
     * Not used by generation itself. Carried for the movement solvers that validate
     * jump and fall trajectories against obstacles.
     */
    @Builder.Default
    int obstacleLayerMask = 0;

    // Character

    /**
     * Not used by generation itself. Carried, with {@link #characterHeight}, for the
     * movement solvers that size jump and fall trajectories to the character.
     */
    @Builder.Default
    double characterRadius = 0.4;

    @Builder.Default
    double characterHeight = 1.8;

    // Top edge detection

    /**
     * Maximum |dy/dx| of a walkable edge. Gentle ramps up to this slope are accepted.
     */
    @Builder.Default
    double slopeThreshold = 0.5;

    /**
     * Edges with a smaller horizontal span are treated as walls.
     */
    @Builder.Default
    double minEdgeSpan = 0.1;

    /**
     * Height above the edge midpoint the verification ray starts from.
     */
    @Builder.Default
    double standingHeight = 1.0;

    @Builder.Default
    double rayLength = 1.5;

    /**
     * Maximum vertical distance between the ray hit and the edge midpoint.
     */
    @Builder.Default
    double surfaceHitTolerance = 0.2;

    /**
     * Required headroom, as a fraction of {@link #standingHeight}.
     */
    @Builder.Default
    double clearanceRatio = 0.8;

    @Builder.Default
    double edgeMergeThreshold = 0.1;

    @Builder.Default
    double edgeDedupThreshold = 0.5;

    // Walk links

    @Builder.Default
    double maxWalkYDiff = 0.5;

    @Builder.Default
    double maxWalkXGap = 3.0;

    // Height transition nodes

    @Builder.Default
    boolean generateHeightTransitionNodes = false;

    @Builder.Default
    double minTransitionHeight = 0.5;

    @Builder.Default
    double maxTransitionHeight = 8.0;

    /**
     * A transition node is skipped when another node already sits within this radius.
     */
    @Builder.Default
    double transitionNodeMergeRadius = 0.3;

    /**
     * Combined mask of every layer a walkable surface can live on.
     */
    public int allPlatformLayers() {
        return groundLayerMask | oneWayPlatformLayerMask;
    }

    /**
     * Interior node spacing actually in effect.
     */
    public double actualNodeSpacing() {
        return useDenseNodes ? denseNodeSpacing : nodeSpacing;
    }

    public Region scanRegion() {
        return new Region(scanCenter, scanSize);
    }

    /**
     * Check that every option holds a usable value.
     *
     * @return this config, for chaining
     * @throws IllegalArgumentException describing the first invalid option
     */
    public PlatformGraphConfig validate() {
        if (scanCenter == null || scanSize == null) {
            throw new IllegalArgumentException("Scan center and size must be set");
        }
        if (!(scanSize.getX() > 0) || !(scanSize.getY() > 0)) {
            throw new IllegalArgumentException("Scan size must be positive, was " + scanSize);
        }
        requirePositive("nodeSpacing", nodeSpacing);
        requirePositive("denseNodeSpacing", denseNodeSpacing);
        requirePositive("spatialGridCellSize", spatialGridCellSize);
        requireNonNegative("edgeInset", edgeInset);
        requireNonNegative("minPlatformWidth", minPlatformWidth);
        // Edge nodes of the narrowest wide surface must not cross
        if (minPlatformWidth < 2 * edgeInset) {
            throw new IllegalArgumentException(String.format(
                    "minPlatformWidth (%s) must be at least twice edgeInset (%s)",
                    minPlatformWidth, edgeInset));
        }
        requirePositive("slopeThreshold", slopeThreshold);
        requireNonNegative("minEdgeSpan", minEdgeSpan);
        requirePositive("standingHeight", standingHeight);
        requirePositive("rayLength", rayLength);
        requirePositive("surfaceHitTolerance", surfaceHitTolerance);
        requireNonNegative("clearanceRatio", clearanceRatio);
        requireNonNegative("edgeMergeThreshold", edgeMergeThreshold);
        requireNonNegative("edgeDedupThreshold", edgeDedupThreshold);
        requirePositive("maxWalkYDiff", maxWalkYDiff);
        requirePositive("maxWalkXGap", maxWalkXGap);
        requireNonNegative("minTransitionHeight", minTransitionHeight);
        requireNonNegative("transitionNodeMergeRadius", transitionNodeMergeRadius);
        if (maxTransitionHeight < minTransitionHeight) {
            throw new IllegalArgumentException(String.format(
                    "maxTransitionHeight (%s) must not be below minTransitionHeight (%s)",
                    maxTransitionHeight, minTransitionHeight));
        }
        if (allPlatformLayers() == 0) {
            throw new IllegalArgumentException("At least one ground or one-way platform layer must be set");
        }
        return this;
    }

    private static void requirePositive(String name, double value) {
        // Negated comparison also rejects NaN
        if (!(value > 0)) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0)) {
            throw new IllegalArgumentException(name + " must not be negative, was " + value);
        }
    }
}
