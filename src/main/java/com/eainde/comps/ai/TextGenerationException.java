package com.eainde.comps.ai;

/**
 * Typed failure of a text-generation call.
 *
 * <p>Every kind counts against the same retry budget; {@link Kind#MALFORMED} covers both
 * unparseable output and output that parses but violates the expected schema.</p>
 */
public class TextGenerationException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        RATE_LIMITED,
        MALFORMED,
        UNAVAILABLE
    }

    private final Kind kind;

    public TextGenerationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TextGenerationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static TextGenerationException malformed(String message) {
        return new TextGenerationException(Kind.MALFORMED, message);
    }

    public Kind getKind() {
        return kind;
    }
}
