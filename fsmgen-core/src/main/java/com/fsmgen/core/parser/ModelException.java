package com.fsmgen.core.parser;

import com.fsmgen.core.model.SourceLine;

import java.util.Objects;

/**
 * Thrown when a diagram cannot be turned into a valid state model.
 *
 * <p>The exception always points at the offending source line: file identity, 1-based line
 * number and the line's original (pre-normalization) text. There is no recovery; a diagram that
 * raises this exception produces no output.
 */
public class ModelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final SourceLine line;

    public ModelException(ErrorKind kind, SourceLine line, String detail) {
        super(format(kind, line, detail));
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.line = Objects.requireNonNull(line, "line must not be null");
    }

    public ModelException(ErrorKind kind, SourceLine line) {
        this(kind, line, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public SourceLine getLine() {
        return line;
    }

    private static String format(ErrorKind kind, SourceLine line, String detail) {
        StringBuilder sb = new StringBuilder();
        sb.append(line.location()).append(": ").append(kind.getDescription());
        if (detail != null && !detail.isEmpty()) {
            sb.append(" (").append(detail).append(')');
        }
        if (!line.originalText().isEmpty()) {
            sb.append(": ").append(line.originalText().strip());
        }
        return sb.toString();
    }
}
