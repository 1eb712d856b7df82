package com.platnav.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.platnav.geometry.Vec2;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link PlatformGraphConfig} from JSON.
 *
 * <p>Keys are snake_case versions of the option names; vectors are two-element arrays.
 * Keys that are absent keep their default. Example:
 * <pre>
 * {
 *   "scan_center": [0, 10],
 *   "scan_size": [200, 60],
 *   "node_spacing": 1.25,
 *   "one_way_platform_layer_mask": 2
 * }
 * </pre>
 *
 * <p>Every loaded config is validated before it is returned.
 */
@Slf4j
public final class PlatformGraphConfigLoader {

    /**
     * Default resource path for the bundled configuration.
     */
    public static final String DEFAULT_RESOURCE_PATH = "/config/platform-graph.json";

    private static final Gson GSON = new GsonBuilder().create();

    private PlatformGraphConfigLoader() {
    }

    // ========================================================================
    // Loading
    // ========================================================================

    /**
     * Load the configuration bundled at {@link #DEFAULT_RESOURCE_PATH}.
     *
     * @return the validated config
     * @throws IOException if the resource is missing or unreadable
     */
    public static PlatformGraphConfig loadFromResources() throws IOException {
        return loadFromResources(DEFAULT_RESOURCE_PATH);
    }

    /**
     * Load a configuration from a classpath resource.
     *
     * @param resourcePath absolute resource path
     * @return the validated config
     * @throws IOException if the resource is missing or unreadable
     */
    public static PlatformGraphConfig loadFromResources(String resourcePath) throws IOException {
        try (InputStream is = PlatformGraphConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                PlatformGraphConfig config = parse(reader);
                log.info("Loaded platform graph config from resource {}", resourcePath);
                return config;
            }
        }
    }

    /**
     * Load a configuration from a file.
     *
     * @param path JSON file path
     * @return the validated config
     * @throws IOException if the file cannot be read
     */
    public static PlatformGraphConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            PlatformGraphConfig config = parse(reader);
            log.info("Loaded platform graph config from {}", path);
            return config;
        }
    }

    /**
     * Parse a configuration from a reader.
     *
     * @throws JsonParseException if the JSON is malformed
     * @throws IllegalArgumentException if a value fails validation
     */
    public static PlatformGraphConfig parse(Reader reader) {
        return toConfig(GSON.fromJson(reader, ConfigData.class));
    }

    /**
     * Parse a configuration from a JSON string.
     *
     * @throws JsonParseException if the JSON is malformed
     * @throws IllegalArgumentException if a value fails validation
     */
    public static PlatformGraphConfig parse(String json) {
        return toConfig(GSON.fromJson(json, ConfigData.class));
    }

    private static PlatformGraphConfig toConfig(ConfigData data) {
        PlatformGraphConfig.PlatformGraphConfigBuilder builder = PlatformGraphConfig.builder();
        if (data == null) {
            return builder.build().validate();
        }

        if (data.scanCenter != null) builder.scanCenter(toVec2("scan_center", data.scanCenter));
        if (data.scanSize != null) builder.scanSize(toVec2("scan_size", data.scanSize));
        if (data.nodeSpacing != null) builder.nodeSpacing(data.nodeSpacing);
        if (data.denseNodeSpacing != null) builder.denseNodeSpacing(data.denseNodeSpacing);
        if (data.useDenseNodes != null) builder.useDenseNodes(data.useDenseNodes);
        if (data.edgeInset != null) builder.edgeInset(data.edgeInset);
        if (data.minPlatformWidth != null) builder.minPlatformWidth(data.minPlatformWidth);
        if (data.spatialGridCellSize != null) builder.spatialGridCellSize(data.spatialGridCellSize);
        if (data.groundLayerMask != null) builder.groundLayerMask(data.groundLayerMask);
        if (data.oneWayPlatformLayerMask != null) builder.oneWayPlatformLayerMask(data.oneWayPlatformLayerMask);
        if (data.obstacleLayerMask != null) builder.obstacleLayerMask(data.obstacleLayerMask);
        if (data.characterRadius != null) builder.characterRadius(data.characterRadius);
        if (data.characterHeight != null) builder.characterHeight(data.characterHeight);
        if (data.slopeThreshold != null) builder.slopeThreshold(data.slopeThreshold);
        if (data.minEdgeSpan != null) builder.minEdgeSpan(data.minEdgeSpan);
        if (data.standingHeight != null) builder.standingHeight(data.standingHeight);
        if (data.rayLength != null) builder.rayLength(data.rayLength);
        if (data.surfaceHitTolerance != null) builder.surfaceHitTolerance(data.surfaceHitTolerance);
        if (data.clearanceRatio != null) builder.clearanceRatio(data.clearanceRatio);
        if (data.edgeMergeThreshold != null) builder.edgeMergeThreshold(data.edgeMergeThreshold);
        if (data.edgeDedupThreshold != null) builder.edgeDedupThreshold(data.edgeDedupThreshold);
        if (data.maxWalkYDiff != null) builder.maxWalkYDiff(data.maxWalkYDiff);
        if (data.maxWalkXGap != null) builder.maxWalkXGap(data.maxWalkXGap);
        if (data.generateHeightTransitionNodes != null) {
            builder.generateHeightTransitionNodes(data.generateHeightTransitionNodes);
        }
        if (data.minTransitionHeight != null) builder.minTransitionHeight(data.minTransitionHeight);
        if (data.maxTransitionHeight != null) builder.maxTransitionHeight(data.maxTransitionHeight);
        if (data.transitionNodeMergeRadius != null) {
            builder.transitionNodeMergeRadius(data.transitionNodeMergeRadius);
        }

        return builder.build().validate();
    }

    private static Vec2 toVec2(String key, double[] values) {
        if (values.length != 2) {
            throw new JsonParseException(key + " must be an array of two numbers");
        }
        return new Vec2(values[0], values[1]);
    }

    // ========================================================================
    // JSON Data Classes
    // ========================================================================

    /**
     * Raw JSON structure. Boxed fields so absent keys can be told apart from zeros.
     */
    private static class ConfigData {
        @SerializedName("scan_center")
        double[] scanCenter;
        @SerializedName("scan_size")
        double[] scanSize;
        @SerializedName("node_spacing")
        Double nodeSpacing;
        @SerializedName("dense_node_spacing")
        Double denseNodeSpacing;
        @SerializedName("use_dense_nodes")
        Boolean useDenseNodes;
        @SerializedName("edge_inset")
        Double edgeInset;
        @SerializedName("min_platform_width")
        Double minPlatformWidth;
        @SerializedName("spatial_grid_cell_size")
        Double spatialGridCellSize;
        @SerializedName("ground_layer_mask")
        Integer groundLayerMask;
        @SerializedName("one_way_platform_layer_mask")
        Integer oneWayPlatformLayerMask;
        @SerializedName("obstacle_layer_mask")
        Integer obstacleLayerMask;
        @SerializedName("character_radius")
        Double characterRadius;
        @SerializedName("character_height")
        Double characterHeight;
        @SerializedName("slope_threshold")
        Double slopeThreshold;
        @SerializedName("min_edge_span")
        Double minEdgeSpan;
        @SerializedName("standing_height")
        Double standingHeight;
        @SerializedName("ray_length")
        Double rayLength;
        @SerializedName("surface_hit_tolerance")
        Double surfaceHitTolerance;
        @SerializedName("clearance_ratio")
        Double clearanceRatio;
        @SerializedName("edge_merge_threshold")
        Double edgeMergeThreshold;
        @SerializedName("edge_dedup_threshold")
        Double edgeDedupThreshold;
        @SerializedName("max_walk_y_diff")
        Double maxWalkYDiff;
        @SerializedName("max_walk_x_gap")
        Double maxWalkXGap;
        @SerializedName("generate_height_transition_nodes")
        Boolean generateHeightTransitionNodes;
        @SerializedName("min_transition_height")
        Double minTransitionHeight;
        @SerializedName("max_transition_height")
        Double maxTransitionHeight;
        @SerializedName("transition_node_merge_radius")
        Double transitionNodeMergeRadius;
    }
}
