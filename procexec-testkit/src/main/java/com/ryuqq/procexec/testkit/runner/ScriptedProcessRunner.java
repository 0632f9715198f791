package com.ryuqq.procexec.testkit.runner;

import com.ryuqq.procexec.core.context.ExecutionContext;
import com.ryuqq.procexec.core.contract.ProcessCommand;
import com.ryuqq.procexec.core.outcome.ProcessOutcome;
import com.ryuqq.procexec.core.outcome.Success;
import com.ryuqq.procexec.core.runner.ProcessRunner;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scripted implementation of ProcessRunner for testing.
 *
 * <p>Does not spawn OS processes. Each executable name can be given a responder that maps the
 * command to an outcome; executables without a responder echo their standard input back as
 * {@link Success} output.</p>
 *
 * <p><strong>Instrumentation:</strong></p>
 * <ul>
 *   <li>Every command passed to {@link #run} is recorded in invocation order</li>
 *   <li>The number of runs in flight and the maximum observed are tracked</li>
 *   <li>An optional hold time keeps each run in flight to widen race windows</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedProcessRunner runner = new ScriptedProcessRunner()
 *     .respond("shellcheck", command -&gt; new FindingsReported(1, "SC2086".getBytes()))
 *     .holdFor(20);
 * </pre>
 *
 * <p><strong>Thread Safety:</strong> Safe for concurrent use.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedProcessRunner implements ProcessRunner {

    private final Map<String, Function<ProcessCommand, ProcessOutcome>> responders = new ConcurrentHashMap<>();
    private final List<ProcessCommand> commands = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger maxInFlight = new AtomicInteger(0);
    private volatile long holdMillis;

    /**
     * Registers a responder for the given executable.
     *
     * @param executable the executable name
     * @param responder maps a command to the outcome to report
     * @return this runner
     */
    public ScriptedProcessRunner respond(String executable, Function<ProcessCommand, ProcessOutcome> responder) {
        if (executable == null || responder == null) {
            throw new IllegalArgumentException("executable and responder cannot be null");
        }
        responders.put(executable, responder);
        return this;
    }

    /**
     * Registers a fixed outcome for the given executable.
     *
     * @param executable the executable name
     * @param outcome the outcome to report
     * @return this runner
     */
    public ScriptedProcessRunner respond(String executable, ProcessOutcome outcome) {
        return respond(executable, command -> outcome);
    }

    /**
     * Keeps every run in flight for the given duration.
     *
     * @param millis hold time in milliseconds
     * @return this runner
     */
    public ScriptedProcessRunner holdFor(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis cannot be negative");
        }
        this.holdMillis = millis;
        return this;
    }

    @Override
    public ProcessOutcome run(ExecutionContext context, ProcessCommand command) {
        if (context == null || command == null) {
            throw new IllegalArgumentException("context and command cannot be null");
        }
        context.throwIfCancelled();
        commands.add(command);

        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            hold();
            Function<ProcessCommand, ProcessOutcome> responder = responders.get(command.executable());
            return responder != null ? responder.apply(command) : new Success(command.standardInput());
        } finally {
            inFlight.decrementAndGet();
        }
    }

    /**
     * Gets the commands run so far, in invocation order.
     *
     * @return a snapshot of recorded commands
     */
    public List<ProcessCommand> getCommands() {
        return new ArrayList<>(commands);
    }

    public int getInvocationCount() {
        return commands.size();
    }

    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * Gets the maximum number of runs observed in flight at the same time.
     *
     * @return the maximum concurrency observed
     */
    public int getMaxInFlight() {
        return maxInFlight.get();
    }

    /**
     * Clears recorded commands, counters and responders.
     */
    public void clear() {
        responders.clear();
        commands.clear();
        inFlight.set(0);
        maxInFlight.set(0);
        holdMillis = 0;
    }

    private void hold() {
        long millis = holdMillis;
        if (millis == 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Scripted run interrupted", e);
        }
    }
}
