package biz.kryukov.dev.healthprobe;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.sql.SQLTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

/**
 * Classifies probe failures into a {@link FailureCategory} value.
 *
 * <p>Classification chain:
 * <ol>
 *   <li>{@link ProbeException} with an explicit category</li>
 *   <li>Platform exception types (timeout, DNS, connection, TLS)</li>
 *   <li>Wrapped exception cause (recursive)</li>
 *   <li>Fallback: {@link FailureCategory#ERROR}</li>
 * </ol>
 */
public final class FailureClassifier {

    private FailureClassifier() {}

    /**
     * Classifies a failure.
     *
     * @param err the failure, never null
     * @return the failure category
     */
    public static String classify(Throwable err) {
        if (err instanceof ProbeException pe) {
            return pe.failureCategory();
        }

        String platform = classifyPlatform(err);
        if (platform != null) {
            return platform;
        }

        Throwable cause = err.getCause();
        if (cause != null && cause != err) {
            String inner = classify(cause);
            if (!FailureCategory.ERROR.equals(inner)) {
                return inner;
            }
        }

        return FailureCategory.ERROR;
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers added by
     * the future machinery so the probe's own exception is reported.
     */
    public static Throwable unwrap(Throwable err) {
        Throwable current = err;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Returns the human-readable text of a failure: its message, or the class name when
     * the message is absent.
     */
    public static String describe(Throwable err) {
        String msg = err.getMessage();
        return msg != null && !msg.isEmpty() ? msg : err.getClass().getName();
    }

    private static String classifyPlatform(Throwable err) {
        if (err instanceof SocketTimeoutException
                || err instanceof TimeoutException
                || err instanceof HttpTimeoutException
                || err instanceof SQLTimeoutException) {
            return FailureCategory.TIMEOUT;
        }
        if (err instanceof UnknownHostException) {
            return FailureCategory.DNS_ERROR;
        }
        if (err instanceof ConnectException || err instanceof NoRouteToHostException) {
            return FailureCategory.CONNECTION_ERROR;
        }
        if (err instanceof SSLException) {
            return FailureCategory.TLS_ERROR;
        }
        return null;
    }
}
