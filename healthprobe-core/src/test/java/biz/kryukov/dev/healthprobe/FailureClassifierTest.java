package biz.kryukov.dev.healthprobe;

import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

    @Test
    void probeExceptionCarriesCategory() {
        assertEquals(FailureCategory.TIMEOUT,
                FailureClassifier.classify(new ProbeTimeoutException(Duration.ofMillis(10))));
        assertEquals(FailureCategory.ERROR,
                FailureClassifier.classify(new ProbeExecutionException("bad")));
    }

    @Test
    void platformExceptions() {
        assertEquals(FailureCategory.TIMEOUT,
                FailureClassifier.classify(new SocketTimeoutException("read timed out")));
        assertEquals(FailureCategory.DNS_ERROR,
                FailureClassifier.classify(new UnknownHostException("nowhere")));
        assertEquals(FailureCategory.CONNECTION_ERROR,
                FailureClassifier.classify(new ConnectException("refused")));
        assertEquals(FailureCategory.TLS_ERROR,
                FailureClassifier.classify(new SSLHandshakeException("bad cert")));
        assertEquals(FailureCategory.ERROR,
                FailureClassifier.classify(new IllegalStateException("boom")));
    }

    @Test
    void classifiesWrappedCause() {
        assertEquals(FailureCategory.CONNECTION_ERROR,
                FailureClassifier.classify(new IOException("io", new ConnectException("refused"))));
    }

    @Test
    void unwrapStripsFutureWrappers() {
        ConnectException cause = new ConnectException("refused");

        assertSame(cause, FailureClassifier.unwrap(
                new CompletionException(new ExecutionException(cause))));
        assertSame(cause, FailureClassifier.unwrap(cause));
    }

    @Test
    void describeFallsBackToClassName() {
        assertEquals("boom", FailureClassifier.describe(new RuntimeException("boom")));
        assertEquals("java.lang.RuntimeException", FailureClassifier.describe(new RuntimeException()));
    }
}
