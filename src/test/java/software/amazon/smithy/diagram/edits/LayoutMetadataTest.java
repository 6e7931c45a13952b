/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.edits;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static software.amazon.smithy.diagram.UtilMatchers.anOptionalOf;

import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import software.amazon.smithy.diagram.gmodel.Dimension;
import software.amazon.smithy.diagram.gmodel.Point;
import software.amazon.smithy.model.node.ObjectNode;

public class LayoutMetadataTest {
    @Test
    public void claimsPendingPositionOnce() {
        LayoutMetadata layout = new LayoutMetadata();
        layout.rememberPending("Entity2", new Point(5, 6));

        assertThat(layout.claimPending("Other", "x"), is(false));
        assertThat(layout.claimPending("Entity2", "id-1"), is(true));
        assertThat(layout.claimPending("Entity2", "id-2"), is(false));
        assertThat(layout.position("id-1"), anOptionalOf(equalTo(new Point(5, 6))));
        assertThat(layout.position("id-2"), equalTo(Optional.empty()));
    }

    @Test
    public void dropsLayoutOfRemovedElements() {
        LayoutMetadata layout = new LayoutMetadata();
        layout.setPosition("a", new Point(1, 1));
        layout.setPosition("b", new Point(2, 2));
        layout.setSize("b", new Dimension(10, 10));

        layout.retainAll(Set.of("a"));

        assertThat(layout.position("a").isPresent(), is(true));
        assertThat(layout.position("b").isPresent(), is(false));
        assertThat(layout.size("b").isPresent(), is(false));
    }

    @Test
    public void storesAndLoadsLayout() {
        LayoutMetadata layout = new LayoutMetadata();
        layout.setPosition("b", new Point(1.5, 2));
        layout.setSize("b", new Dimension(100, 50));
        layout.setSize("a", new Dimension(10, 20));

        ObjectNode stored = layout.toNode();
        LayoutMetadata loaded = new LayoutMetadata();
        loaded.setPosition("stale", new Point(0, 0));
        loaded.load(stored);

        assertThat(stored.getStringMap().keySet(), contains("a", "b"));
        assertThat(stored.expectObjectMember("a").getMember("x").isPresent(), is(false));
        assertThat(loaded.position("b"), anOptionalOf(equalTo(new Point(1.5, 2))));
        assertThat(loaded.size("b"), anOptionalOf(equalTo(new Dimension(100, 50))));
        assertThat(loaded.size("a"), anOptionalOf(equalTo(new Dimension(10, 20))));
        assertThat(loaded.position("a").isPresent(), is(false));
        assertThat(loaded.position("stale").isPresent(), is(false));
    }
}
