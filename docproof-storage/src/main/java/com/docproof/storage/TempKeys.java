package com.docproof.storage;

/**
 * Temp-store key layout and categories. Keys are {@code <category>:<runId>}.
 */
public final class TempKeys {

    public static final String RAW_INVOICE = "raw-invoice";
    public static final String PARSED_INVOICE = "parsed-invoice";
    public static final String CANONICAL_INVOICE = "canonical-invoice";
    public static final String INTERMEDIATE = "intermediate";
    public static final String EXTERNAL_RESPONSE = "external-response";
    public static final String UNKNOWN = "unknown";

    private static final String[] KNOWN = {RAW_INVOICE, PARSED_INVOICE, CANONICAL_INVOICE, INTERMEDIATE, EXTERNAL_RESPONSE};

    private TempKeys() {
    }

    public static String rawInvoice(String runId) {
        return RAW_INVOICE + ":" + runId;
    }

    public static String parsedInvoice(String runId) {
        return PARSED_INVOICE + ":" + runId;
    }

    public static String key(String category, String runId) {
        return category + ":" + runId;
    }

    /** Category encoded in the key prefix, or {@value #UNKNOWN}. */
    public static String categoryOf(String key) {
        if (key == null) return UNKNOWN;
        int idx = key.indexOf(':');
        if (idx <= 0) return UNKNOWN;
        String prefix = key.substring(0, idx);
        for (String k : KNOWN) {
            if (k.equals(prefix)) return k;
        }
        return UNKNOWN;
    }
}
