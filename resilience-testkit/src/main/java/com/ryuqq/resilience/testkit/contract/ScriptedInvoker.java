package com.ryuqq.resilience.testkit.contract;

import com.ryuqq.resilience.core.model.Request;
import com.ryuqq.resilience.core.model.Response;
import com.ryuqq.resilience.core.model.Target;
import com.ryuqq.resilience.core.spi.Invoker;

import java.time.Duration;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Invoker test double that plays back a scripted sequence of outcomes.
 *
 * <p>Each invocation consumes the next scripted step. Once the script is exhausted
 * every further invocation uses the fallback step (by default a successful
 * {@code "ok"} response). Invocation counts are tracked in total and per target.</p>
 *
 * <pre>
 * ScriptedInvoker invoker = new ScriptedInvoker()
 *     .thenFail(new IOException("reset"))
 *     .thenFail(new IOException("reset"))
 *     .thenRespond("done");
 * </pre>
 *
 * <p>Thread-safe: concurrent callers each consume a distinct step.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ScriptedInvoker implements Invoker {

    /**
     * One scripted outcome.
     */
    @FunctionalInterface
    public interface Step {
        Response run(Request request) throws Exception;
    }

    private final Queue<Step> script = new ConcurrentLinkedQueue<>();
    private final Map<Target, AtomicInteger> perTarget = new ConcurrentHashMap<>();
    private final AtomicInteger invocations = new AtomicInteger();
    private volatile Step fallback = request -> Response.of("ok");

    public ScriptedInvoker thenRespond(String body) {
        script.add(request -> Response.of(body));
        return this;
    }

    public ScriptedInvoker thenFail(Exception failure) {
        script.add(request -> {
            throw failure;
        });
        return this;
    }

    /**
     * Scripts a step that blocks for the given duration before responding.
     *
     * <p>The wait is interruptible, so a cancelled attempt ends promptly.</p>
     */
    public ScriptedInvoker thenRespondAfter(Duration delay, String body) {
        script.add(request -> {
            Thread.sleep(delay.toMillis());
            return Response.of(body);
        });
        return this;
    }

    public ScriptedInvoker then(Step step) {
        script.add(step);
        return this;
    }

    /**
     * Replaces the step used once the script runs out.
     */
    public ScriptedInvoker otherwise(Step step) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        this.fallback = step;
        return this;
    }

    public ScriptedInvoker otherwiseRespond(String body) {
        return otherwise(request -> Response.of(body));
    }

    public ScriptedInvoker otherwiseFail(Exception failure) {
        return otherwise(request -> {
            throw failure;
        });
    }

    @Override
    public Response invoke(Request request) throws Exception {
        invocations.incrementAndGet();
        perTarget.computeIfAbsent(request.target(), key -> new AtomicInteger()).incrementAndGet();

        Step step = script.poll();
        return (step != null ? step : fallback).run(request);
    }

    public int invocationCount() {
        return invocations.get();
    }

    public int invocationCount(Target target) {
        AtomicInteger count = perTarget.get(target);
        return count == null ? 0 : count.get();
    }

    public int remainingSteps() {
        return script.size();
    }
}
