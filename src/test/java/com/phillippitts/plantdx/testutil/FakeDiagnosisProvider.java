package com.phillippitts.plantdx.testutil;

import com.phillippitts.plantdx.domain.ClassificationRequest;
import com.phillippitts.plantdx.domain.ProviderResult;
import com.phillippitts.plantdx.exception.ProviderCallException;
import com.phillippitts.plantdx.service.provider.DiagnosisProvider;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scriptable provider double.
 *
 * <p>Each call consumes the next scripted step; the last step repeats once the script is
 * exhausted. Steps may return a result, throw, or block.
 */
public class FakeDiagnosisProvider implements DiagnosisProvider {

    private final String name;
    private final Deque<Function<ClassificationRequest, ProviderResult>> script = new ArrayDeque<>();
    private Function<ClassificationRequest, ProviderResult> last;
    private RuntimeException probeFailure;

    public final AtomicInteger calls = new AtomicInteger();
    public final AtomicInteger probes = new AtomicInteger();
    public final AtomicInteger interrupts = new AtomicInteger();
    public volatile ClassificationRequest lastRequest;

    public FakeDiagnosisProvider(String name) {
        this.name = name;
    }

    public static FakeDiagnosisProvider returning(ProviderResult result) {
        return new FakeDiagnosisProvider(result.provider()).thenReturn(result);
    }

    public static FakeDiagnosisProvider failing(String name, ProviderCallException failure) {
        return new FakeDiagnosisProvider(name).thenThrow(failure);
    }

    public synchronized FakeDiagnosisProvider thenReturn(ProviderResult result) {
        script.addLast(req -> result);
        return this;
    }

    public synchronized FakeDiagnosisProvider thenThrow(RuntimeException failure) {
        script.addLast(req -> {
            throw failure;
        });
        return this;
    }

    public synchronized FakeDiagnosisProvider thenReturnAfter(ProviderResult result, long delayMs) {
        script.addLast(req -> {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderCallException("interrupted", name, false);
            }
            return result;
        });
        return this;
    }

    /** Blocks until interrupted, then throws a non-retryable error. */
    public synchronized FakeDiagnosisProvider thenHang() {
        script.addLast(req -> {
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                interrupts.incrementAndGet();
                Thread.currentThread().interrupt();
            }
            throw new ProviderCallException("interrupted", name, false);
        });
        return this;
    }

    public FakeDiagnosisProvider probeFailsWith(RuntimeException failure) {
        this.probeFailure = failure;
        return this;
    }

    @Override
    public String getProviderName() {
        return name;
    }

    @Override
    public ProviderResult classify(ClassificationRequest request) {
        calls.incrementAndGet();
        lastRequest = request;
        Function<ClassificationRequest, ProviderResult> step;
        synchronized (this) {
            if (!script.isEmpty()) {
                last = script.removeFirst();
            }
            step = last;
        }
        if (step == null) {
            throw new IllegalStateException("No behaviour scripted for " + name);
        }
        return step.apply(request);
    }

    @Override
    public void probe() {
        probes.incrementAndGet();
        if (probeFailure != null) {
            throw probeFailure;
        }
    }
}
