package io.stageflow.core.state;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Per-element history side-table owned by a process.
///
/// Histories are created on the first recorded transition for an element id
/// and kept until cleared explicitly. The `fromState` of each appended
/// transition is the state recorded just before it.
///
/// @implNote Thread-safe. Every operation runs under one store-wide lock, so
/// concurrent evaluations of the same element id append in a serial order.
/// Readers receive copies.
public final class StateHistoryStore {

    private final Object lock = new Object();
    private final Map<String, ElementHistory> histories = new LinkedHashMap<>();
    private final Map<String, EvaluationSnapshot> snapshots = new LinkedHashMap<>();

    /// A transition waiting to be appended; its `fromState` is filled in by the store.
    ///
    /// @param toState state reached, not null
    /// @param stageName associated stage, may be null
    /// @param reason short explanation, may be null
    /// @param metadata extra details, may be null
    public record Entry(
            EvaluationState toState, String stageName, String reason, Map<String, Object> metadata) {

        public Entry {
            Objects.requireNonNull(toState, "toState must not be null");
        }
    }

    /// Appends one transition, creating the element's history if needed.
    ///
    /// @apiNote **Side effects**: Modifies the element's history
    ///
    /// @param elementId element identifier, not null
    /// @param timestamp recording time, not null
    /// @param entry the transition to append, not null
    /// @return the appended transition, never null
    public StateTransition record(String elementId, Instant timestamp, Entry entry) {
        return recordAll(elementId, timestamp, List.of(entry)).get(0);
    }

    /// Appends several transitions atomically, chaining their `fromState`.
    ///
    /// @apiNote **Side effects**: Modifies the element's history
    ///
    /// @param elementId element identifier, not null
    /// @param timestamp recording time shared by all entries, not null
    /// @param entries transitions to append in order, not null
    /// @return the appended transitions, never null
    public List<StateTransition> recordAll(String elementId, Instant timestamp, List<Entry> entries) {
        return recordAll(elementId, timestamp, entries, null);
    }

    /// Appends several transitions and replaces the element's snapshot in one step.
    ///
    /// @apiNote **Side effects**: Modifies the element's history and snapshot
    ///
    /// @param elementId element identifier, not null
    /// @param timestamp recording time shared by all entries, not null
    /// @param entries transitions to append in order, not null
    /// @param snapshot what the element satisfied, or null to keep the previous one
    /// @return the appended transitions, never null
    public List<StateTransition> recordAll(
            String elementId, Instant timestamp, List<Entry> entries, EvaluationSnapshot snapshot) {
        Objects.requireNonNull(elementId, "elementId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(entries, "entries must not be null");
        List<StateTransition> appended = new ArrayList<>(entries.size());
        if (entries.isEmpty()) {
            return appended;
        }
        synchronized (lock) {
            if (snapshot != null) {
                snapshots.put(elementId, snapshot);
            }
            ElementHistory history =
                    histories.computeIfAbsent(elementId, id -> new ElementHistory(id, timestamp));
            EvaluationState previous = history.getCurrentState().orElse(null);
            for (Entry entry : entries) {
                StateTransition transition =
                        new StateTransition(
                                timestamp,
                                previous,
                                entry.toState(),
                                entry.stageName(),
                                entry.reason(),
                                entry.metadata());
                history.addTransition(transition);
                appended.add(transition);
                previous = entry.toState();
            }
        }
        return appended;
    }

    /// Returns a snapshot of an element's history.
    ///
    /// @param elementId element identifier, not null
    /// @return copy of the history, or empty if none is recorded
    public Optional<ElementHistory> get(String elementId) {
        synchronized (lock) {
            ElementHistory history = histories.get(elementId);
            return history == null ? Optional.empty() : Optional.of(history.copy());
        }
    }

    /// Returns the last stage recorded for an element.
    ///
    /// @param elementId element identifier, not null
    /// @return stage name, or empty if no transition named a stage
    public Optional<String> lastStage(String elementId) {
        synchronized (lock) {
            ElementHistory history = histories.get(elementId);
            return history == null ? Optional.empty() : history.getCurrentStage();
        }
    }

    /// Returns what the element satisfied at its last recorded evaluation.
    ///
    /// @param elementId element identifier, not null
    /// @return the snapshot, or empty if none is recorded
    public Optional<EvaluationSnapshot> snapshot(String elementId) {
        synchronized (lock) {
            return Optional.ofNullable(snapshots.get(elementId));
        }
    }

    /// @return ids of elements with recorded history, in first-seen order
    public List<String> elementIds() {
        synchronized (lock) {
            return List.copyOf(histories.keySet());
        }
    }

    /// Deletes one element's history.
    ///
    /// @param elementId element identifier, not null
    /// @return true if a history was removed
    public boolean clear(String elementId) {
        synchronized (lock) {
            snapshots.remove(elementId);
            return histories.remove(elementId) != null;
        }
    }

    /// Deletes every history.
    ///
    /// @return number of histories removed
    public int clearAll() {
        synchronized (lock) {
            int count = histories.size();
            histories.clear();
            snapshots.clear();
            return count;
        }
    }

    public int size() {
        synchronized (lock) {
            return histories.size();
        }
    }
}
