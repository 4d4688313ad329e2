package io.narrata.core.debug;

import io.narrata.core.NarrataConfig;
import io.narrata.core.execution.ExecutionListener;
import io.narrata.core.execution.StepEngine;
import io.narrata.core.execution.StepOutcome;
import io.narrata.core.state.ChangeRecord;
import io.narrata.core.state.ConsoleLevel;
import io.narrata.core.state.ExecutionLogEntry;
import io.narrata.core.state.ExecutionState;
import io.narrata.core.state.ExecutionStatus;
import io.narrata.core.variable.Values;
import io.narrata.core.variable.Variable;
import io.narrata.core.variable.VariableSource;
import io.narrata.core.variable.VariableType;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Debugger wrapped around the {@link StepEngine}.
///
/// Adds undo through snapshots, breakpoints, the runaway-loop guard, user
/// overrides of variable values and timer-driven auto-play on top of plain
/// stepping.
///
/// ### Snapshots
/// A snapshot is pushed before every step and every response choice.
/// {@link #stepBack()} restores the latest one verbatim, truncating the
/// console and execution log to their recorded lengths. User overrides do
/// not push a snapshot.
///
/// ### Auto-play
/// Each tick runs one step, then stops auto-play when the session finished,
/// stalled, reached its step limit, or just executed a node that carries a
/// breakpoint. While a dialogue waits for input, auto-play idles and resumes
/// after {@link #chooseResponse(String)}.
///
/// @implNote Thread-safe. Every operation is `synchronized`, so a tick on the
/// scheduler thread never interleaves with a user action. Listener callbacks
/// run with the session lock held.
public final class DebugSession implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(DebugSession.class.getName());

    private final ExecutionState state;
    private final StepEngine engine;
    private final NarrataConfig config;
    private final ScheduledExecutorService scheduler;

    private boolean autoPlaying;
    private long autoPlayDelayMillis;
    private ScheduledFuture<?> pendingTick;
    private long tickGeneration;
    private boolean closed;

    /// Creates a session with its own single-thread auto-play scheduler.
    ///
    /// @param state fresh session state, not null
    /// @param engine step engine, not null
    /// @param config session configuration, not null
    public DebugSession(ExecutionState state, StepEngine engine, NarrataConfig config) {
        this(state, engine, config, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "narrata-autoplay-" + state.getSessionId());
            t.setDaemon(true);
            return t;
        }));
    }

    DebugSession(
            ExecutionState state,
            StepEngine engine,
            NarrataConfig config,
            ScheduledExecutorService scheduler) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.autoPlayDelayMillis = config.clampAutoPlayDelay(config.getAutoPlayDelayMillis());
        state.addConsole(ConsoleLevel.INFO, "Debug session started");
        logger.info("Debug session " + state.getSessionId() + " started in flow "
                + state.getCurrentFlowId() + " at node " + state.getCurrentNodeId());
    }

    public String getSessionId() {
        return state.getSessionId();
    }

    /// Registers a listener for console, change and auto-play events.
    ///
    /// @param listener listener, or null to remove the current one
    public synchronized void setListener(ExecutionListener listener) {
        state.setListener(listener);
    }

    /// Returns the current render view.
    public synchronized DebugView view() {
        return DebugView.of(state, autoPlaying, autoPlayDelayMillis);
    }

    /// Executes one node.
    ///
    /// Refused without any change when the session is finished, waiting for
    /// a response, or at its step limit.
    public synchronized DebugView step() {
        runStep();
        return view();
    }

    /// Undoes the latest step or response choice. No-op when nothing can be undone.
    public synchronized DebugView stepBack() {
        if (!state.canStepBack()) {
            return view();
        }
        if (autoPlaying) {
            stopAutoPlay("step back");
        }
        state.restoreLatestSnapshot();
        if (state.getStatus() == ExecutionStatus.RUNNING) {
            state.setStatus(ExecutionStatus.PAUSED);
        }
        logger.fine("Stepped back to node " + state.getCurrentNodeId());
        return view();
    }

    /// Starts auto-play. No-op when already playing or when no step could run.
    public synchronized DebugView play() {
        if (autoPlaying || closed) {
            return view();
        }
        ExecutionStatus status = state.getStatus();
        if (status == ExecutionStatus.FINISHED || state.isStepLimitReached()) {
            return view();
        }
        autoPlaying = true;
        if (status != ExecutionStatus.WAITING_INPUT) {
            state.setStatus(ExecutionStatus.RUNNING);
            scheduleTick();
        }
        logger.info("Auto-play started with " + autoPlayDelayMillis + " ms delay");
        return view();
    }

    /// Stops auto-play and cancels the pending tick.
    public synchronized DebugView pause() {
        if (autoPlaying) {
            stopAutoPlay("paused");
        }
        return view();
    }

    /// Adds a breakpoint on the node, or removes it if one is set.
    public synchronized DebugView toggleBreakpoint(String nodeId) {
        boolean set = state.toggleBreakpoint(nodeId);
        logger.fine((set ? "Breakpoint set on " : "Breakpoint cleared on ") + nodeId);
        return view();
    }

    /// Overrides a variable value outside of any assignment.
    ///
    /// The value is coerced to the variable's type. The change is recorded
    /// with source `user_override`; no snapshot is taken.
    ///
    /// @param key variable key, not null
    /// @param value new value, may be null
    public synchronized DebugView setVariable(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        Optional<Variable> current = state.getVariables().get(key);
        if (current.isEmpty()) {
            state.addConsole(ConsoleLevel.WARNING, "User override: variable " + key + " not found");
            return view();
        }
        Variable variable = current.get();
        Object newValue = null;
        if (value != null) {
            Optional<Object> coerced = Values.coerce(variable.getType(), value);
            if (coerced.isEmpty()) {
                state.addConsole(
                        ConsoleLevel.WARNING,
                        "User override: " + Values.display(value) + " is not a valid "
                                + variable.getType().id() + " for " + key);
                return view();
            }
            newValue = coerced.get();
        }
        override(variable, newValue);
        return view();
    }

    /// Overrides a variable value from raw editor text.
    ///
    /// Numbers that do not parse become `0` with a warning; booleans are true
    /// only for `"true"`. Other types follow {@link #setVariable(String, Object)}.
    ///
    /// @param key variable key, not null
    /// @param raw text typed by the user, may be null
    public synchronized DebugView setVariableFromText(String key, String raw) {
        Objects.requireNonNull(key, "key must not be null");
        Optional<Variable> current = state.getVariables().get(key);
        if (current.isEmpty()) {
            return setVariable(key, raw);
        }
        VariableType type = current.get().getType();
        String text = raw != null ? raw.trim() : "";
        if (type == VariableType.NUMBER) {
            Optional<Object> number = Values.coerce(type, text);
            if (number.isEmpty()) {
                state.addConsole(
                        ConsoleLevel.WARNING, "Invalid number \"" + text + "\", using 0");
                override(current.get(), 0L);
                return view();
            }
            override(current.get(), number.get());
            return view();
        }
        if (type == VariableType.BOOLEAN) {
            override(current.get(), "true".equalsIgnoreCase(text));
            return view();
        }
        return setVariable(key, raw);
    }

    /// Resolves a pending dialogue choice.
    ///
    /// Refused with a warning entry when the session is not waiting, the
    /// response is unknown or its condition failed.
    public synchronized DebugView chooseResponse(String responseId) {
        Objects.requireNonNull(responseId, "responseId must not be null");
        Optional<String> refusal = engine.checkCanChoose(state, responseId);
        if (refusal.isPresent()) {
            state.addConsole(ConsoleLevel.WARNING, "Cannot choose response: " + refusal.get());
            return view();
        }
        state.pushSnapshot();
        engine.chooseResponse(state, responseId);
        if (autoPlaying) {
            state.setStatus(ExecutionStatus.RUNNING);
            scheduleTick();
        }
        return view();
    }

    /// Raises the step limit by the configured increment. No-op below the limit.
    public synchronized DebugView continuePastLimit() {
        if (!state.isStepLimitReached()) {
            return view();
        }
        state.raiseMaxSteps(config.getStepLimitIncrement());
        state.addConsole(
                ConsoleLevel.INFO, "Step limit raised to " + state.getMaxSteps() + " steps");
        logger.info("Session " + state.getSessionId() + " step limit raised to "
                + state.getMaxSteps());
        return view();
    }

    /// Restarts from the initial variables and start node, keeping breakpoints.
    public synchronized DebugView reset() {
        if (autoPlaying) {
            stopAutoPlay("reset");
        }
        state.reset(config.getMaxSteps());
        state.addConsole(ConsoleLevel.INFO, "Debug session started");
        logger.info("Debug session " + state.getSessionId() + " reset");
        return view();
    }

    /// Sets the pause between auto-play ticks, clamped to the configured range.
    public synchronized DebugView setAutoPlayDelay(long delayMillis) {
        autoPlayDelayMillis = config.clampAutoPlayDelay(delayMillis);
        return view();
    }

    /// Applies a command value.
    public DebugView apply(DebugCommand command) {
        return Objects.requireNonNull(command, "command must not be null").apply(this);
    }

    /// Runs a scheduled tick unless a later schedule or a stop has superseded it.
    synchronized void tick(long generation) {
        if (generation != tickGeneration) {
            logger.fine("Dropped stale auto-play tick");
            return;
        }
        tick();
    }

    /// Runs one auto-play tick.
    synchronized void tick() {
        pendingTick = null;
        if (!autoPlaying || closed || state.getStatus() == ExecutionStatus.WAITING_INPUT) {
            return;
        }
        String executedNodeId = state.getCurrentNodeId();
        StepOutcome outcome = runStep();
        switch (outcome) {
            case FINISHED -> stopAutoPlay("finished");
            case STALLED -> stopAutoPlay("error");
            case REFUSED -> stopAutoPlay(state.isStepLimitReached() ? "step limit" : "refused");
            case ADVANCED, WAITING_INPUT -> {
                if (state.getBreakpoints().contains(executedNodeId)) {
                    state.addConsole(
                            ConsoleLevel.INFO, executedNodeId, lastVisitedLabel(),
                            "Breakpoint hit", List.of());
                    stopAutoPlay("breakpoint");
                } else if (state.isStepLimitReached()) {
                    stopAutoPlay("step limit");
                } else if (outcome == StepOutcome.ADVANCED) {
                    scheduleTick();
                }
            }
        }
    }

    /// Returns true while auto-play is active, including while it idles on a dialogue.
    public synchronized boolean isAutoPlaying() {
        return autoPlaying;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        if (autoPlaying) {
            stopAutoPlay("closed");
        }
        closed = true;
        scheduler.shutdownNow();
        logger.info("Debug session " + state.getSessionId() + " closed");
    }

    private StepOutcome runStep() {
        Optional<String> refusal = engine.checkCanStep(state);
        if (refusal.isPresent()) {
            logger.fine("Step refused: " + refusal.get());
            return StepOutcome.REFUSED;
        }
        state.pushSnapshot();
        return engine.step(state);
    }

    private void override(Variable variable, Object newValue) {
        Object oldValue = variable.getValue();
        state.setVariables(
                state.getVariables().with(variable.withValue(newValue, VariableSource.USER_OVERRIDE)));
        state.recordChange(
                new ChangeRecord(
                        state.elapsedMillis(),
                        null,
                        null,
                        variable.getKey(),
                        oldValue,
                        newValue,
                        VariableSource.USER_OVERRIDE,
                        VariableSource.USER_OVERRIDE.id()));
        state.addConsole(
                ConsoleLevel.INFO,
                "User override: " + variable.getKey() + ": " + Values.display(oldValue) + " → "
                        + Values.display(newValue));
    }

    private String lastVisitedLabel() {
        List<ExecutionLogEntry> log = state.getExecutionLog();
        return log.isEmpty() ? null : log.get(log.size() - 1).nodeLabel();
    }

    private void scheduleTick() {
        if (closed) {
            return;
        }
        if (pendingTick != null) {
            pendingTick.cancel(false);
        }
        long generation = ++tickGeneration;
        pendingTick = scheduler.schedule(
                () -> tick(generation), autoPlayDelayMillis, TimeUnit.MILLISECONDS);
    }

    private void stopAutoPlay(String reason) {
        autoPlaying = false;
        tickGeneration++;
        if (pendingTick != null) {
            pendingTick.cancel(false);
            pendingTick = null;
        }
        if (state.getStatus() == ExecutionStatus.RUNNING) {
            state.setStatus(ExecutionStatus.PAUSED);
        }
        logger.info("Auto-play stopped: " + reason);
        state.getListener().onAutoPlayStopped(reason);
    }
}
