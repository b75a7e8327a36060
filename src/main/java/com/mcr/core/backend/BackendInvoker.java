package com.mcr.core.backend;

import com.mcr.core.error.BackendException;
import com.mcr.core.error.BackendTimeoutException;
import com.mcr.core.error.McrException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs calls to the generative, reasoner and embedding backends under their
 * configured timeouts. The calling request blocks; other requests are unaffected.
 * <p>
 * Failures surface as {@link BackendException}; a timeout as
 * {@link BackendTimeoutException}, after which the call's thread is interrupted.
 * Core exceptions thrown by the call itself propagate unchanged.
 */
@Component
public class BackendInvoker implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(BackendInvoker.class);

    public static final String GENERATIVE = "generative";
    public static final String REASONER = "reasoner";
    public static final String EMBEDDING = "embedding";

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final BackendProperties properties;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "mcr-backend-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public BackendInvoker(BackendProperties properties) {
        this.properties = properties;
    }

    public <T> T generative(Supplier<T> call) {
        return call(GENERATIVE, properties.getGenerativeTimeout(), call);
    }

    public <T> T reasoner(Supplier<T> call) {
        return call(REASONER, properties.getReasonerTimeout(), call);
    }

    public <T> T embedding(Supplier<T> call) {
        return call(EMBEDDING, properties.getEmbeddingTimeout(), call);
    }

    <T> T call(String backend, Duration timeout, Supplier<T> call) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return direct(backend, call);
        }
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return call.get();
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} backend call timed out after {}ms", backend, timeout.toMillis());
            throw new BackendTimeoutException(backend, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new BackendException(backend + " call interrupted", e);
        } catch (ExecutionException e) {
            throw translate(backend, e.getCause());
        }
    }

    private <T> T direct(String backend, Supplier<T> call) {
        try {
            return call.get();
        } catch (McrException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(backend, e);
        }
    }

    private static RuntimeException translate(String backend, Throwable cause) {
        if (cause instanceof McrException mcr) {
            return mcr;
        }
        log.warn("{} backend call failed: {}", backend, cause == null ? "unknown" : cause.getMessage());
        return new BackendException(backend + " call failed: "
                + (cause == null ? "unknown" : cause.getMessage()), cause);
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
