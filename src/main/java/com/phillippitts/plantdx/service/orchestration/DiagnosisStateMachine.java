package com.phillippitts.plantdx.service.orchestration;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static com.phillippitts.plantdx.service.orchestration.DiagnosisStage.COLLECTING;
import static com.phillippitts.plantdx.service.orchestration.DiagnosisStage.DISPATCHING;
import static com.phillippitts.plantdx.service.orchestration.DiagnosisStage.DONE;
import static com.phillippitts.plantdx.service.orchestration.DiagnosisStage.FAILED;
import static com.phillippitts.plantdx.service.orchestration.DiagnosisStage.FALLBACK_PROBING;
import static com.phillippitts.plantdx.service.orchestration.DiagnosisStage.FINALIZING;
import static com.phillippitts.plantdx.service.orchestration.DiagnosisStage.IDLE;
import static com.phillippitts.plantdx.service.orchestration.DiagnosisStage.PREPROCESSING;

/**
 * Thread-safe state machine for one diagnosis request.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → PREPROCESSING → DISPATCHING
 * DISPATCHING → COLLECTING | FALLBACK_PROBING | FINALIZING
 * COLLECTING → FINALIZING
 * FALLBACK_PROBING → FINALIZING
 * FINALIZING → DONE
 * any non-terminal stage → FAILED
 * </pre>
 *
 * <p>Primary mode moves stages from a dispatch worker thread while the caller may fail the
 * request on timeout, so every access goes through a {@link ReentrantLock}.
 */
public final class DiagnosisStateMachine {

    private static final Map<DiagnosisStage, Set<DiagnosisStage>> ALLOWED = Map.of(
            IDLE, EnumSet.of(PREPROCESSING),
            PREPROCESSING, EnumSet.of(DISPATCHING),
            DISPATCHING, EnumSet.of(COLLECTING, FALLBACK_PROBING, FINALIZING),
            COLLECTING, EnumSet.of(FINALIZING),
            FALLBACK_PROBING, EnumSet.of(FINALIZING),
            FINALIZING, EnumSet.of(DONE));

    private final Lock lock = new ReentrantLock();
    private DiagnosisStage stage = IDLE;

    /**
     * Moves to the next stage.
     *
     * @param next target stage (use {@link #fail()} for FAILED)
     * @throws IllegalStateException if the transition is not allowed
     */
    public void transitionTo(DiagnosisStage next) {
        lock.lock();
        try {
            moveTo(next);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to the next stage unless the request already finished, for worker threads that may
     * outlive a request the caller has failed.
     *
     * @return {@code false} if the request is already DONE or FAILED
     * @throws IllegalStateException if the request is active and the transition is not allowed
     */
    public boolean transitionIfActive(DiagnosisStage next) {
        lock.lock();
        try {
            if (stage.isTerminal()) {
                return false;
            }
            moveTo(next);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void moveTo(DiagnosisStage next) {
        Set<DiagnosisStage> allowed = ALLOWED.getOrDefault(stage, Set.of());
        if (!allowed.contains(next)) {
            throw new IllegalStateException("Illegal diagnosis transition " + stage + " -> " + next);
        }
        stage = next;
    }

    /**
     * Marks the request failed.
     *
     * @return {@code true} if the stage changed, {@code false} if already terminal
     */
    public boolean fail() {
        lock.lock();
        try {
            if (stage.isTerminal()) {
                return false;
            }
            stage = FAILED;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public DiagnosisStage current() {
        lock.lock();
        try {
            return stage;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminal() {
        return current().isTerminal();
    }
}
