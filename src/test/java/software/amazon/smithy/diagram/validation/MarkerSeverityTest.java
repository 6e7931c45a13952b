/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.validation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import org.eclipse.lsp4j.DiagnosticSeverity;
import org.junit.jupiter.api.Test;

public class MarkerSeverityTest {
    @Test
    public void mapsLspScale() {
        assertThat(MarkerSeverity.fromLsp(1), equalTo(MarkerSeverity.ERROR));
        assertThat(MarkerSeverity.fromLsp(2), equalTo(MarkerSeverity.WARNING));
        assertThat(MarkerSeverity.fromLsp(3), equalTo(MarkerSeverity.INFO));
        assertThat(MarkerSeverity.fromLsp(4), equalTo(MarkerSeverity.HINT));
    }

    @Test
    public void defaultsToErrorOutsideScale() {
        assertThat(MarkerSeverity.fromLsp(0), equalTo(MarkerSeverity.ERROR));
        assertThat(MarkerSeverity.fromLsp(5), equalTo(MarkerSeverity.ERROR));
        assertThat(MarkerSeverity.fromLsp(-1), equalTo(MarkerSeverity.ERROR));
    }

    @Test
    public void mapsDiagnosticSeverities() {
        assertThat(MarkerSeverity.fromLsp(DiagnosticSeverity.Information), equalTo(MarkerSeverity.INFO));
        assertThat(MarkerSeverity.fromLsp(DiagnosticSeverity.Hint), equalTo(MarkerSeverity.HINT));
        assertThat(MarkerSeverity.fromLsp((DiagnosticSeverity) null), equalTo(MarkerSeverity.ERROR));
    }

    @Test
    public void usesLowerCaseWireNames() {
        assertThat(MarkerSeverity.HINT.wireName(), equalTo("hint"));
    }
}
