/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.grammar;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import software.amazon.smithy.diagram.ast.AstValue;
import software.amazon.smithy.diagram.gmodel.Dimension;
import software.amazon.smithy.diagram.properties.FieldClassification;
import software.amazon.smithy.diagram.properties.PropertyOverride;
import software.amazon.smithy.model.loader.ModelSyntaxException;
import software.amazon.smithy.model.node.ArrayNode;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.NumberNode;
import software.amazon.smithy.model.node.ObjectNode;
import software.amazon.smithy.model.node.StringNode;
import software.amazon.smithy.utils.IoUtils;
import software.amazon.smithy.utils.ListUtils;
import software.amazon.smithy.utils.MapUtils;
import software.amazon.smithy.utils.SmithyBuilder;

/**
 * Static per-grammar configuration: how AST types map to diagram types, which
 * field an edge type writes, what text a new node is inserted as, and how
 * fields are classified and defaulted.
 *
 * <p>A manifest is loaded once per grammar and shared read-only by every
 * document of that grammar. The JSON form looks like:
 * <pre>
 * {
 *     "languageId": "entities",
 *     "nodeTypes": { "Entity": "node:entity" },
 *     "edgeTypes": { "edge:inheritance": "extends" },
 *     "templates": { "Entity": "\n\nentity ${name} {\n}\n" },
 *     "defaultSizes": { "Entity": { "width": 160, "height": 80 } },
 *     "propertyOverrides": { "members": "child" },
 *     "defaults": { "Entity": { "abstract": false } }
 * }
 * </pre>
 */
public final class Manifest {
    public static final String NAME_PLACEHOLDER = "${name}";

    private final String languageId;
    private final Map<String, String> nodeTypes;
    private final Map<String, String> edgeTypes;
    private final Map<String, String> templates;
    private final Map<String, Dimension> defaultSizes;
    private final List<PropertyOverride> propertyOverrides;
    private final Map<String, Map<String, AstValue>> defaults;

    private Manifest(Builder builder) {
        this.languageId = SmithyBuilder.requiredState("languageId", builder.languageId);
        this.nodeTypes = MapUtils.copyOf(builder.nodeTypes);
        this.edgeTypes = MapUtils.copyOf(builder.edgeTypes);
        this.templates = MapUtils.copyOf(builder.templates);
        this.defaultSizes = MapUtils.copyOf(builder.defaultSizes);
        this.propertyOverrides = ListUtils.copyOf(builder.propertyOverrides);
        Map<String, Map<String, AstValue>> defaultsCopy = new LinkedHashMap<>();
        builder.defaults.forEach((type, fields) ->
                defaultsCopy.put(type, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        this.defaults = Collections.unmodifiableMap(defaultsCopy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param languageId The language id of the grammar
     * @return A manifest that declares nothing, so every lookup falls back to
     *  the built-in heuristics
     */
    public static Manifest empty(String languageId) {
        return builder().languageId(languageId).build();
    }

    /**
     * Loads a manifest bundled as a class path resource.
     *
     * @param resourceName Absolute resource path
     * @return The loaded manifest
     * @throws ManifestException If the resource is missing or malformed
     */
    public static Manifest fromResource(String resourceName) {
        String json;
        try {
            json = IoUtils.readUtf8Resource(Manifest.class.getClassLoader(), stripLeadingSlash(resourceName));
        } catch (RuntimeException e) {
            throw new ManifestException("Unable to read manifest resource " + resourceName, e);
        }
        return fromJson(json);
    }

    /**
     * @param json Manifest JSON text
     * @return The parsed manifest
     * @throws ManifestException If the text isn't a valid manifest
     */
    public static Manifest fromJson(String json) {
        try {
            return fromNode(Node.parse(json));
        } catch (ModelSyntaxException e) {
            throw new ManifestException("Manifest is not valid JSON: " + e.getMessage(), e);
        }
    }

    /**
     * @param node Parsed manifest
     * @return The manifest
     * @throws ManifestException If a member has the wrong shape
     */
    public static Manifest fromNode(Node node) {
        ObjectNode root = node.asObjectNode()
                .orElseThrow(() -> new ManifestException("Manifest must be a JSON object"));

        Builder builder = builder();
        builder.languageId(root.getStringMember("languageId")
                .map(StringNode::getValue)
                .orElseThrow(() -> new ManifestException("Manifest is missing required member 'languageId'")));

        stringMap(root, "nodeTypes").forEach(builder::putNodeType);
        stringMap(root, "edgeTypes").forEach(builder::putEdgeType);
        stringMap(root, "templates").forEach(builder::putTemplate);

        objectMember(root, "defaultSizes").getStringMap().forEach((type, value) ->
                builder.putDefaultSize(type, dimension("defaultSizes." + type, value)));

        stringMap(root, "propertyOverrides").forEach((field, classification) -> builder.addPropertyOverride(
                new PropertyOverride(field, FieldClassification.fromString(classification)
                        .orElseThrow(() -> new ManifestException("Invalid classification '" + classification
                                                                 + "' for property override " + field)))));

        objectMember(root, "defaults").getStringMap().forEach((type, value) -> {
            ObjectNode fields = value.asObjectNode()
                    .orElseThrow(() -> new ManifestException("Manifest member 'defaults." + type
                                                             + "' must be an object"));
            fields.getStringMap().forEach((field, fieldValue) ->
                    builder.putDefault(type, field, toAstValue("defaults." + type + "." + field, fieldValue)));
        });

        return builder.build();
    }

    public String languageId() {
        return languageId;
    }

    /**
     * @return AST type to diagram node type, in declaration order
     */
    public Map<String, String> nodeTypes() {
        return nodeTypes;
    }

    /**
     * @param astType AST type tag
     * @return The diagram node type declared for {@code astType}
     */
    public Optional<String> nodeTypeOf(String astType) {
        return Optional.ofNullable(nodeTypes.get(astType));
    }

    /**
     * @param nodeType Diagram node type
     * @return The AST type tag whose declared diagram type is exactly
     *  {@code nodeType}
     */
    public Optional<String> astTypeOf(String nodeType) {
        for (Map.Entry<String, String> entry : nodeTypes.entrySet()) {
            if (entry.getValue().equals(nodeType)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * @param edgeType Diagram edge type
     * @return The AST field an edge of this type is written to
     */
    public Optional<String> referenceFieldOf(String edgeType) {
        return Optional.ofNullable(edgeTypes.get(edgeType));
    }

    /**
     * @param referenceField AST field holding a reference
     * @return The diagram edge type declared for the field
     */
    public Optional<String> edgeTypeOf(String referenceField) {
        for (Map.Entry<String, String> entry : edgeTypes.entrySet()) {
            if (entry.getValue().equals(referenceField)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * @param astType AST type tag
     * @return The insertion template for new nodes of the type, containing
     *  {@link #NAME_PLACEHOLDER}
     */
    public Optional<String> templateOf(String astType) {
        return Optional.ofNullable(templates.get(astType));
    }

    public Optional<Dimension> defaultSizeOf(String astType) {
        return Optional.ofNullable(defaultSizes.get(astType));
    }

    public List<PropertyOverride> propertyOverrides() {
        return propertyOverrides;
    }

    /**
     * @param astType AST type tag
     * @return Fields every node of the type has, with the value they take
     *  when not written in source
     */
    public Map<String, AstValue> defaultsOf(String astType) {
        return defaults.getOrDefault(astType, Collections.emptyMap());
    }

    private static String stripLeadingSlash(String resourceName) {
        return resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
    }

    private static ObjectNode objectMember(ObjectNode root, String member) {
        Optional<Node> value = root.getMember(member);
        if (value.isEmpty()) {
            return Node.objectNode();
        }
        return value.get().asObjectNode()
                .orElseThrow(() -> new ManifestException("Manifest member '" + member + "' must be an object"));
    }

    private static Map<String, String> stringMap(ObjectNode root, String member) {
        Map<String, String> result = new LinkedHashMap<>();
        objectMember(root, member).getStringMap().forEach((key, value) -> result.put(key, value.asStringNode()
                .map(StringNode::getValue)
                .orElseThrow(() -> new ManifestException("Manifest member '" + member + "." + key
                                                         + "' must be a string"))));
        return result;
    }

    private static Dimension dimension(String path, Node value) {
        ObjectNode object = value.asObjectNode()
                .orElseThrow(() -> new ManifestException("Manifest member '" + path + "' must be an object"));
        double width = object.getNumberMember("width")
                .map(n -> n.getValue().doubleValue())
                .orElseThrow(() -> new ManifestException("Manifest member '" + path + "' is missing 'width'"));
        double height = object.getNumberMember("height")
                .map(n -> n.getValue().doubleValue())
                .orElseThrow(() -> new ManifestException("Manifest member '" + path + "' is missing 'height'"));
        return new Dimension(width, height);
    }

    private static AstValue toAstValue(String path, Node value) {
        if (value.isNullNode()) {
            return AstValue.Null.INSTANCE;
        } else if (value.isBooleanNode()) {
            return new AstValue.Bool(value.expectBooleanNode().getValue());
        } else if (value.isNumberNode()) {
            NumberNode number = value.expectNumberNode();
            return new AstValue.Num(new BigDecimal(number.getValue().toString()));
        } else if (value.isStringNode()) {
            return new AstValue.Str(value.expectStringNode().getValue());
        } else if (value.isArrayNode()) {
            ArrayNode array = value.expectArrayNode();
            List<AstValue> elements = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                elements.add(toAstValue(path + "[" + i + "]", array.get(i).get()));
            }
            return new AstValue.Many(elements);
        }
        throw new ManifestException("Manifest member '" + path + "' must be a scalar or an array of scalars");
    }

    public static final class Builder implements SmithyBuilder<Manifest> {
        private String languageId;
        private final Map<String, String> nodeTypes = new LinkedHashMap<>();
        private final Map<String, String> edgeTypes = new LinkedHashMap<>();
        private final Map<String, String> templates = new LinkedHashMap<>();
        private final Map<String, Dimension> defaultSizes = new LinkedHashMap<>();
        private final List<PropertyOverride> propertyOverrides = new ArrayList<>();
        private final Map<String, Map<String, AstValue>> defaults = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder languageId(String languageId) {
            this.languageId = languageId;
            return this;
        }

        public Builder putNodeType(String astType, String nodeType) {
            this.nodeTypes.put(astType, nodeType);
            return this;
        }

        public Builder putEdgeType(String edgeType, String referenceField) {
            this.edgeTypes.put(edgeType, referenceField);
            return this;
        }

        public Builder putTemplate(String astType, String template) {
            this.templates.put(astType, template);
            return this;
        }

        public Builder putDefaultSize(String astType, Dimension size) {
            this.defaultSizes.put(astType, size);
            return this;
        }

        public Builder addPropertyOverride(PropertyOverride override) {
            this.propertyOverrides.add(override);
            return this;
        }

        public Builder putDefault(String astType, String field, AstValue value) {
            this.defaults.computeIfAbsent(astType, k -> new LinkedHashMap<>()).put(field, value);
            return this;
        }

        @Override
        public Manifest build() {
            return new Manifest(this);
        }
    }
}
