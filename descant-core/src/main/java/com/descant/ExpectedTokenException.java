package com.descant;

/**
 * Thrown inside the parser to abandon the current production. The parser
 * catches it at the next declaration boundary and turns it into an
 * {@link ErrorEntry}; it never escapes a public parser method.
 */
final class ExpectedTokenException extends RuntimeException {

    private final SourcePosition position;
    private final boolean fallback;

    ExpectedTokenException(String message, SourcePosition position) {
        this(message, position, false);
    }

    ExpectedTokenException(String message, SourcePosition position, boolean fallback) {
        super(message, null, false, false);
        this.position = position;
        this.fallback = fallback;
    }

    SourcePosition position() {
        return position;
    }

    ErrorEntry toErrorEntry() {
        return new ErrorEntry(position, getMessage(), false, fallback);
    }
}
