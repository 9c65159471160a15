package com.jslowering.util;

import com.jslowering.ast.SourceLocation;

/**
 * A reported error.
 */
public record Diagnostic(SourceLocation location, String message) {

    /**
     * Formats as {@code line:column: message}, or just the message without a location.
     */
    public String format() {
        if (location == null) {
            return message;
        }
        return location.start().line() + ":" + location.start().column() + ": " + message;
    }
}
