package biz.kryukov.dev.healthprobe;

import java.util.List;

/**
 * Failure category constants attached to synthesized unhealthy results.
 */
public final class FailureCategory {

    /** Metadata key under which the category is stored on a synthesized result. */
    public static final String METADATA_KEY = "failure";

    public static final String TIMEOUT = "timeout";
    public static final String CONNECTION_ERROR = "connection_error";
    public static final String DNS_ERROR = "dns_error";
    public static final String TLS_ERROR = "tls_error";
    public static final String ERROR = "error";

    /** All category values. */
    public static final List<String> ALL = List.of(
            TIMEOUT, CONNECTION_ERROR, DNS_ERROR, TLS_ERROR, ERROR
    );

    private FailureCategory() {}
}
