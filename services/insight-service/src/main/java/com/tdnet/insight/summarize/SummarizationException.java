package com.tdnet.insight.summarize;

public class SummarizationException extends RuntimeException {

    public enum Kind {
        /** Quota or throttling response; worth retrying after a pause. */
        RATE_LIMITED,
        FATAL
    }

    private final Kind kind;

    public SummarizationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isRateLimited() {
        return kind == Kind.RATE_LIMITED;
    }
}
