package com.jslowering.util;

import com.jslowering.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps every reported error in report order.
 */
public class CollectingErrorReporter implements ErrorReporter {

    private static final Logger LOG = Logger.getLogger(CollectingErrorReporter.class.getName());

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void reportError(SourceLocation location, String format, Object... args) {
        Diagnostic diagnostic = new Diagnostic(location, formatMessage(format, args));
        diagnostics.add(diagnostic);
        LOG.log(Level.WARNING, diagnostic.format());
    }

    // a pattern that does not fit its arguments still yields a diagnostic
    private static String formatMessage(String format, Object... args) {
        if (args == null || args.length == 0) {
            return format;
        }
        try {
            return String.format(format, args);
        } catch (IllegalFormatException e) {
            LOG.log(Level.FINE, "Malformed diagnostic pattern: " + format, e);
            return format;
        }
    }

    @Override
    public boolean hadError() {
        return !diagnostics.isEmpty();
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public void clearErrors() {
        diagnostics.clear();
    }
}
