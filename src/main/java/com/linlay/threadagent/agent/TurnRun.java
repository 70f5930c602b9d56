package com.linlay.threadagent.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-turn state holder. Transitions must move forward; once terminal the state is fixed.
 */
final class TurnRun {

    private static final Logger log = LoggerFactory.getLogger(TurnRun.class);

    private final String tag;
    private final long startedAt = System.nanoTime();
    private final AtomicReference<OrchestratorState> state = new AtomicReference<>(OrchestratorState.IDLE);

    TurnRun(String tag) {
        this.tag = tag;
    }

    String tag() {
        return tag;
    }

    OrchestratorState state() {
        return state.get();
    }

    void advance(OrchestratorState next) {
        OrchestratorState current = state.get();
        while (true) {
            if (current.terminal() || next.ordinal() <= current.ordinal()) {
                throw new IllegalStateException("turn " + tag + " cannot move from " + current + " to " + next);
            }
            if (state.compareAndSet(current, next)) {
                log.debug("[turn:{}] {} -> {}", tag, current, next);
                return;
            }
            current = state.get();
        }
    }

    boolean fail() {
        OrchestratorState current = state.get();
        while (!current.terminal()) {
            if (state.compareAndSet(current, OrchestratorState.FAILED)) {
                log.debug("[turn:{}] {} -> FAILED", tag, current);
                return true;
            }
            current = state.get();
        }
        return false;
    }

    long elapsedMillis() {
        return (System.nanoTime() - startedAt) / 1_000_000;
    }
}
