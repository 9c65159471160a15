package com.jslowering.util;

import com.jslowering.ast.SourceLocation;

/**
 * Sink for compilation errors. Reporting never throws and never stops the caller; a pass
 * keeps going so that later errors are reported too.
 */
public interface ErrorReporter {

    /**
     * Reports an error.
     *
     * @param location where the error occurred, or null when unknown
     * @param format a {@link String#format} pattern
     * @param args the pattern arguments
     */
    void reportError(SourceLocation location, String format, Object... args);

    /**
     * Returns true if any error has been reported.
     */
    boolean hadError();
}
