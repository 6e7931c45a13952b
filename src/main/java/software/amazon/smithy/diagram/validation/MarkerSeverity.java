/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.validation;

import java.util.Locale;
import org.eclipse.lsp4j.DiagnosticSeverity;

public enum MarkerSeverity {
    ERROR,
    WARNING,
    INFO,
    HINT;

    /**
     * Translates the numeric LSP severity scale. Values outside of it are
     * treated as errors.
     *
     * @param severity The LSP severity, possibly {@code null}
     * @return The marker severity
     */
    public static MarkerSeverity fromLsp(DiagnosticSeverity severity) {
        if (severity == null) {
            return ERROR;
        }
        return fromLsp(severity.getValue());
    }

    /**
     * @param value A severity on the LSP scale (1 error to 4 hint)
     * @return The marker severity
     */
    public static MarkerSeverity fromLsp(int value) {
        return switch (value) {
            case 2 -> WARNING;
            case 3 -> INFO;
            case 4 -> HINT;
            default -> ERROR;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
