/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.document;

import java.nio.CharBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import software.amazon.smithy.diagram.protocol.LspAdapter;

/**
 * In-memory representation of a text document, indexed by line, which can
 * be patched in-place.
 *
 * <p>Methods on this class will often return {@code -1} or {@code null} for
 * failure cases to reduce allocations, since these methods may be called
 * frequently. Unlike most index-based lookups, an index equal to
 * {@link #length()} is valid: it addresses the end of the document, which is
 * where appended text goes.
 */
public final class Document {
    private final StringBuilder buffer;
    private int[] lineIndices;

    private Document(StringBuilder buffer, int[] lineIndices) {
        this.buffer = buffer;
        this.lineIndices = lineIndices;
    }

    /**
     * @param string String to create a document for
     * @return The created document
     */
    public static Document of(String string) {
        StringBuilder buffer = new StringBuilder(string);
        return new Document(buffer, computeLineIndices(buffer));
    }

    /**
     * @return A copy of this document
     */
    public Document copy() {
        return new Document(new StringBuilder(copyText()), lineIndices.clone());
    }

    /**
     * @param range The range to apply the edit to. Providing {@code null} will
     *              replace the text in the document
     * @param text The text of the edit to apply
     */
    public void applyEdit(Range range, String text) {
        if (range == null) {
            buffer.replace(0, buffer.length(), text);
        } else {
            Position start = range.getStart();
            Position end = range.getEnd();
            if (start.getLine() >= lineIndices.length) {
                buffer.append(text);
            } else {
                int startIndex = lineIndices[start.getLine()] + start.getCharacter();
                if (end.getLine() >= lineIndices.length) {
                    buffer.replace(startIndex, buffer.length(), text);
                } else {
                    int endIndex = lineIndices[end.getLine()] + end.getCharacter();
                    buffer.replace(startIndex, endIndex, text);
                }
            }
        }
        this.lineIndices = computeLineIndices(buffer);
    }

    /**
     * Applies a batch of edits that were all computed against the current
     * text. Edits are applied back to front so earlier ranges stay valid.
     *
     * @param edits The edits to apply
     */
    public void applyEdits(Collection<TextEdit> edits) {
        List<TextEdit> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparingInt((TextEdit edit) -> indexOfPosition(edit.getRange().getStart()))
                .reversed());
        for (TextEdit edit : ordered) {
            applyEdit(edit.getRange(), edit.getNewText());
        }
    }

    /**
     * @param range The range to check
     * @return Whether both ends of {@code range} are within this document and
     *  the start doesn't come after the end
     */
    public boolean isValidRange(Range range) {
        if (range == null || range.getStart() == null || range.getEnd() == null) {
            return false;
        }
        int start = indexOfPosition(range.getStart());
        int end = indexOfPosition(range.getEnd());
        return start >= 0 && end >= start;
    }

    /**
     * @return The range of the document, from (0, 0) to {@link #end()}
     */
    public Range fullRange() {
        return LspAdapter.offset(end());
    }

    /**
     * @param line The line to find the index of
     * @return The index of the start of the given {@code line}, or {@code -1}
     *  if the line doesn't exist
     */
    public int indexOfLine(int line) {
        if (line >= lineIndices.length || line < 0) {
            return -1;
        }
        return lineIndices[line];
    }

    /**
     * @param idx Index to find the line of
     * @return The line that {@code idx} is within or {@code -1} if the index
     *  is out of bounds
     */
    public int lineOfIndex(int idx) {
        if (idx > length() || idx < 0) {
            return -1;
        }

        int found = Arrays.binarySearch(lineIndices, idx);
        if (found >= 0) {
            return found;
        }
        // Insertion point is the first line starting after idx
        return -found - 2;
    }

    /**
     * @param position The position to find the index of
     * @return The index of the position in this document, or {@code -1} if the
     *  position is out of bounds
     */
    public int indexOfPosition(Position position) {
        return indexOfPosition(position.getLine(), position.getCharacter());
    }

    /**
     * @param line The line of the index to find
     * @param character The character offset in the line
     * @return The index of the position in this document, or {@code -1} if the
     *  position is out of bounds
     */
    public int indexOfPosition(int line, int character) {
        int startLineIdx = indexOfLine(line);
        if (startLineIdx < 0 || character < 0) {
            return -1;
        }

        int idx = startLineIdx + character;
        if (line == lastLine()) {
            if (idx > buffer.length()) {
                return -1;
            }
        } else if (idx >= indexOfLine(line + 1)) {
            // index is onto next line
            return -1;
        }

        return idx;
    }

    /**
     * @param index The index to find the position of
     * @return The position of the index in this document, or {@code null} if
     *  the index is out of bounds
     */
    public Position positionAtIndex(int index) {
        int line = lineOfIndex(index);
        if (line < 0) {
            return null;
        }
        return new Position(line, index - indexOfLine(line));
    }

    /**
     * @return The line number of the last line in this document
     */
    public int lastLine() {
        return lineIndices.length - 1;
    }

    /**
     * @return The end position of this document
     */
    public Position end() {
        return new Position(
                lineIndices.length - 1,
                buffer.length() - lineIndices[lineIndices.length - 1]);
    }

    /**
     * @param s The string to find the next index of
     * @param after The index to start the search at
     * @return The index of the next occurrence of {@code s} after {@code after}
     *  or {@code -1} if one doesn't exist
     */
    public int nextIndexOf(String s, int after) {
        return buffer.indexOf(s, after);
    }

    /**
     * @param s The string to find the last index of
     * @param before The index to end the search at
     * @return The index of the last occurrence of {@code s} before {@code before}
     *  or {@code -1} if one doesn't exist
     */
    public int lastIndexOf(String s, int before) {
        return buffer.lastIndexOf(s, before);
    }

    /**
     * @return A reference to the text in this document
     */
    public CharSequence borrowText() {
        return buffer;
    }

    /**
     * @param start The index of the start of the span to borrow
     * @param end The end of the index of the span to borrow (exclusive)
     * @return A reference to the text within the indices {@code start} and
     *  {@code end}, or {@code null} if the span is out of bounds or start > end
     */
    public CharBuffer borrowSpan(int start, int end) {
        if (start < 0 || end < 0) {
            return null;
        }

        // end is exclusive
        if (end > buffer.length() || start > end) {
            return null;
        }

        return CharBuffer.wrap(buffer, start, end);
    }

    /**
     * @return A copy of the text of this document
     */
    public String copyText() {
        return buffer.toString();
    }

    /**
     * @param range The range to copy the text of
     * @return A copy of the text in this document within the given {@code range}
     *  or {@code null} if the range is out of bounds
     */
    public String copyRange(Range range) {
        int start = indexOfPosition(range.getStart());
        int end = indexOfPosition(range.getEnd());
        return copySpan(start, end);
    }

    /**
     * @param start The index of the start of the span to copy
     * @param end The index of the end of the span to copy
     * @return A copy of the text within the indices {@code start} and
     *  {@code end}, or {@code null} if the span is out of bounds or start > end
     */
    public String copySpan(int start, int end) {
        CharBuffer borrowed = borrowSpan(start, end);
        if (borrowed == null) {
            return null;
        }
        return borrowed.toString();
    }

    /**
     * @return The length of the document
     */
    public int length() {
        return buffer.length();
    }

    /**
     * @param index The index to get the character at
     * @return The character at the given index, or {@code \u0000} if one
     *  doesn't exist
     */
    public char charAt(int index) {
        if (index < 0 || index >= length()) {
            return '\u0000';
        }
        return buffer.charAt(index);
    }

    private static int[] computeLineIndices(StringBuilder buffer) {
        int off = 0;
        int next;
        List<Integer> indices = new ArrayList<>();
        indices.add(0);
        // Works with \r\n line breaks by forgetting about the \r, since the
        // content of the line doesn't matter here
        while ((next = buffer.indexOf("\n", off)) != -1) {
            indices.add(next + 1);
            off = next + 1;
        }
        return indices.stream().mapToInt(Integer::intValue).toArray();
    }
}
