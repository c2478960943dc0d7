package com.querygate.execution;

import com.querygate.engine.EngineException;
import com.querygate.engine.EngineFaultException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs engine calls on worker threads and stops waiting for them at a deadline.
 *
 * <p>On expiry the worker is interrupted and its eventual result discarded. A call that ignores
 * the interrupt keeps its worker until the driver returns, which is why the pool is unbounded.
 */
@Slf4j
public class DeadlineRunner implements AutoCloseable {
    private final ExecutorService workers;

    public DeadlineRunner() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "querygate-engine-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.workers = Executors.newCachedThreadPool(factory);
    }

    public <T> T callWithin(Duration timeout, EngineCall<T> call) throws EngineException, TimeoutException {
        Future<T> future = workers.submit(call::call);
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Engine call abandoned after {} ms", timeout.toMillis());
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EngineFaultException("Interrupted while waiting for the engine", null, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EngineException engineException) {
                throw engineException;
            }
            if (cause instanceof TimeoutException timeoutException) {
                throw timeoutException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new EngineFaultException(String.valueOf(cause), null, cause);
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
