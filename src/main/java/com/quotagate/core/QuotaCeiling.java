package com.quotagate.core;

/**
 * The three ceilings, declared in the order they are evaluated.
 * The first one violated decides the rejection.
 */
public enum QuotaCeiling {

    REQUESTS_PER_MINUTE("requests per minute", "rpm"),
    TOKENS_PER_MINUTE("tokens per minute", "tpm"),
    REQUESTS_PER_DAY("requests per day", "rpd");

    private final String label;
    private final String tag;

    QuotaCeiling(String label, String tag) {
        this.label = label;
        this.tag = tag;
    }

    /**
     * Human-readable name used in rejection reasons
     */
    public String label() {
        return label;
    }

    /**
     * Short metric tag value
     */
    public String tag() {
        return tag;
    }

    public boolean isMinuteWindow() {
        return this != REQUESTS_PER_DAY;
    }
}
