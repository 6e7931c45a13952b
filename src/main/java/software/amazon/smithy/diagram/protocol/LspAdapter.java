/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.protocol;

import java.nio.file.Paths;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;

/**
 * Utility methods for building LSP {@link Range}s, {@link Position}s and
 * {@link TextEdit}s, and for handling document URIs (which are just strings).
 */
public final class LspAdapter {
    private LspAdapter() {
    }

    /**
     * @return Range of (0, 0) - (0, 0)
     */
    public static Range origin() {
        return point(0, 0);
    }

    /**
     * @param point Position to create a point range of
     * @return Range of (point) - (point)
     */
    public static Range point(Position point) {
        return new Range(point, point);
    }

    /**
     * @param line Line of the point
     * @param character Character offset on the line
     * @return Range of (line, character) - (line, character)
     */
    public static Range point(int line, int character) {
        return point(new Position(line, character));
    }

    /**
     * @param offset Offset from (0, 0)
     * @return Range of (0, 0) - (offset)
     */
    public static Range offset(Position offset) {
        return of(0, 0, offset.getLine(), offset.getCharacter());
    }

    /**
     * @param startLine Range start line
     * @param startCharacter Range start character
     * @param endLine Range end line
     * @param endCharacter Range end character
     * @return Range of (startLine, startCharacter) - (endLine, endCharacter)
     */
    public static Range of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    /**
     * @param range The range to check
     * @return Whether the range's start is equal to it's end
     */
    public static boolean isEmpty(Range range) {
        return range.getStart().equals(range.getEnd());
    }

    /**
     * @param at Where to insert
     * @param text The text to insert
     * @return An edit inserting {@code text} at {@code at}
     */
    public static TextEdit insert(Position at, String text) {
        return new TextEdit(point(at), text);
    }

    /**
     * @param range The range to delete
     * @return An edit deleting everything within {@code range}
     */
    public static TextEdit delete(Range range) {
        return new TextEdit(range, "");
    }

    /**
     * Documents can only be tracked when they come from the file system or
     * are unsaved editor buffers.
     *
     * @param uri LSP URI to check
     * @return Whether the uri can identify a document
     */
    public static boolean isDocumentUri(String uri) {
        return uri != null && (uri.startsWith("file:") || uri.startsWith("untitled:"));
    }

    /**
     * @param path Path to convert to LSP URI
     * @return A URI representation of the given {@code path}
     */
    public static String toUri(String path) {
        if (path.startsWith("file:") || path.startsWith("untitled:")) {
            return path;
        }
        return Paths.get(path).toUri().toString();
    }
}
