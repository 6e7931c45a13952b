/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.Optional;
import java.util.logging.Logger;
import software.amazon.smithy.diagram.gmodel.Dimension;
import software.amazon.smithy.diagram.properties.PropertyExtractor;
import software.amazon.smithy.diagram.sync.ChangePropagationPipeline;

public final class SyncOptions {
    private static final Logger LOGGER = Logger.getLogger(SyncOptions.class.getName());

    private final int maxDepth;
    private final long defaultDebounceMs;
    private final long maxDebounceMs;
    private final Dimension defaultNodeSize;
    private final Dimension bounds;

    private SyncOptions(Builder builder) {
        this.maxDepth = builder.maxDepth;
        this.defaultDebounceMs = builder.defaultDebounceMs;
        this.maxDebounceMs = builder.maxDebounceMs;
        this.defaultNodeSize = builder.defaultNodeSize;
        this.bounds = builder.bounds;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public long getDefaultDebounceMs() {
        return defaultDebounceMs;
    }

    public long getMaxDebounceMs() {
        return maxDebounceMs;
    }

    public Dimension getDefaultNodeSize() {
        return defaultNodeSize;
    }

    /**
     * @return The visible diagram area, if one was configured
     */
    public Optional<Dimension> getBounds() {
        return Optional.ofNullable(bounds);
    }

    public static SyncOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates options from the initialization options sent by the client.
     * Values that can't be used are logged and left at their defaults.
     *
     * @param initializationOptions The client's initialization options,
     *                              expected to be a {@link JsonObject}
     * @return The options
     */
    public static SyncOptions fromInitializationOptions(Object initializationOptions) {
        Builder builder = builder();
        if (initializationOptions instanceof JsonObject jsonObject) {
            if (jsonObject.has("properties.maxDepth")) {
                readInt(jsonObject, "properties.maxDepth").filter(depth -> depth >= 0).ifPresentOrElse(
                        builder::setMaxDepth,
                        () -> invalid("properties.maxDepth", "a non-negative integer"));
            }
            if (jsonObject.has("sync.debounceMs")) {
                readInt(jsonObject, "sync.debounceMs").filter(ms -> ms >= 0).ifPresentOrElse(
                        ms -> builder.setDefaultDebounceMs(ms),
                        () -> invalid("sync.debounceMs", "a non-negative integer"));
            }
            if (jsonObject.has("diagram.bounds")) {
                readDimension(jsonObject, "diagram.bounds").ifPresentOrElse(
                        builder::setBounds,
                        () -> invalid("diagram.bounds", "an object with positive width and height"));
            }
            if (jsonObject.has("diagram.defaultNodeSize")) {
                readDimension(jsonObject, "diagram.defaultNodeSize").ifPresentOrElse(
                        builder::setDefaultNodeSize,
                        () -> invalid("diagram.defaultNodeSize", "an object with positive width and height"));
            }
        }
        return builder.build();
    }

    private static Optional<Integer> readInt(JsonObject jsonObject, String key) {
        JsonElement element = jsonObject.get(key);
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
            return Optional.of(element.getAsInt());
        }
        return Optional.empty();
    }

    private static Optional<Dimension> readDimension(JsonObject jsonObject, String key) {
        JsonElement element = jsonObject.get(key);
        if (!element.isJsonObject()) {
            return Optional.empty();
        }
        JsonObject object = element.getAsJsonObject();
        if (!isNumber(object.get("width")) || !isNumber(object.get("height"))) {
            return Optional.empty();
        }
        Dimension dimension = new Dimension(object.get("width").getAsDouble(), object.get("height").getAsDouble());
        return dimension.isPositive() ? Optional.of(dimension) : Optional.empty();
    }

    private static boolean isNumber(JsonElement element) {
        return element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber();
    }

    private static void invalid(String key, String expected) {
        LOGGER.warning(() -> String.format("""
                Invalid value for '%s'. Must be %s.""", key, expected));
    }

    public static final class Builder {
        private int maxDepth = PropertyExtractor.DEFAULT_MAX_DEPTH;
        private long defaultDebounceMs = ChangePropagationPipeline.DEFAULT_DEBOUNCE_MS;
        private long maxDebounceMs = ChangePropagationPipeline.MAX_DEBOUNCE_MS;
        private Dimension defaultNodeSize = new Dimension(100, 50);
        private Dimension bounds;

        private Builder() {
        }

        public Builder setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder setDefaultDebounceMs(long defaultDebounceMs) {
            this.defaultDebounceMs = defaultDebounceMs;
            return this;
        }

        public Builder setMaxDebounceMs(long maxDebounceMs) {
            this.maxDebounceMs = maxDebounceMs;
            return this;
        }

        public Builder setDefaultNodeSize(Dimension defaultNodeSize) {
            this.defaultNodeSize = defaultNodeSize;
            return this;
        }

        public Builder setBounds(Dimension bounds) {
            this.bounds = bounds;
            return this;
        }

        public SyncOptions build() {
            return new SyncOptions(this);
        }
    }
}
