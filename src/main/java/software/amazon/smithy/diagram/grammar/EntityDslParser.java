/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.grammar;

import software.amazon.smithy.diagram.document.Document;

/**
 * Parser for the entities language, a small declarative language used as the
 * reference grammar:
 * <pre>
 * // comments run to the end of the line
 * entity User {
 *     description: "A person"
 *     role: admin
 *     extends: Base
 *     roles: [{ name: "a" }, { name: "b" }]
 *     score: Score { value: 3 }
 *     property id {
 *         type: String
 *     }
 * }
 * </pre>
 *
 * <p>A top-level or nested {@code keyword Name { ... }} declares a node whose
 * type is the capitalized keyword and whose {@code name} is {@code Name}.
 * Top-level declarations are collected into the root's {@code elements}
 * field, nested ones into the declaring node's {@code members} field. Field
 * values are strings, numbers, {@code true}, {@code false}, {@code null},
 * lowercase bare tokens, capitalized bare tokens (references to a declared
 * name), {@code Type { ... }} nodes, bare {@code { ... }} records, and
 * {@code [ ... ]} lists of any of those. Commas are optional.
 */
public final class EntityDslParser implements DocumentParser {
    public static final String LANGUAGE_ID = "entities";
    public static final String MANIFEST_RESOURCE = "software/amazon/smithy/diagram/grammar/entities.manifest.json";

    private final Manifest manifest;

    public EntityDslParser(Manifest manifest) {
        this.manifest = manifest;
    }

    /**
     * @return A parser configured with the manifest bundled for the language
     */
    public static EntityDslParser withBundledManifest() {
        return new EntityDslParser(Manifest.fromResource(MANIFEST_RESOURCE));
    }

    public Manifest manifest() {
        return manifest;
    }

    @Override
    public ParseResult parse(Document document) {
        return new EntityDslReader(document, manifest).parseModel();
    }
}
