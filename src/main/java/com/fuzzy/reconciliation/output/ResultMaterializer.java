package com.fuzzy.reconciliation.output;

import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.incremental.AssignmentChange;
import com.fuzzy.reconciliation.incremental.AssignmentDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Projects assignment diffs onto the left-join view and emits the output events that bring
 * downstream consumers up to date.
 *
 * <p>The changes of each left id are folded into one final row and compared with the row
 * emitted previously:</p>
 * <ul>
 *   <li>new left record: upsert;</li>
 *   <li>partner replaced or lost: retract of the old matched tuple, then upsert;</li>
 *   <li>partner gained or confidence changed: upsert;</li>
 *   <li>left record removed: retract of the last tuple.</li>
 * </ul>
 * Only the rows named in the diff are touched. Not thread-safe.
 */
public class ResultMaterializer {
    private static final Logger log = LoggerFactory.getLogger(ResultMaterializer.class);

    private final Map<RecordId, OutputRow> rows = new TreeMap<>();

    /**
     * Applies one diff.
     *
     * @return output events in left-id order
     * @throws IllegalStateException if the diff does not fit the rows materialized so far
     */
    public List<OutputEvent> apply(AssignmentDiff diff) {
        Objects.requireNonNull(diff, "diff is required");
        Map<RecordId, List<AssignmentChange>> byLeft = new TreeMap<>();
        for (AssignmentChange change : diff.changes()) {
            byLeft.computeIfAbsent(change.leftId(), id -> new ArrayList<>()).add(change);
        }

        // Fold every group before mutating so an inconsistent diff leaves the view untouched.
        Map<RecordId, OutputRow> updated = new TreeMap<>();
        for (Map.Entry<RecordId, List<AssignmentChange>> entry : byLeft.entrySet()) {
            updated.put(entry.getKey(), fold(entry.getKey(), rows.get(entry.getKey()), entry.getValue()));
        }

        List<OutputEvent> events = new ArrayList<>();
        for (Map.Entry<RecordId, OutputRow> entry : updated.entrySet()) {
            RecordId leftId = entry.getKey();
            OutputRow before = rows.get(leftId);
            OutputRow after = entry.getValue();
            emit(before, after, events);
            if (after == null) {
                rows.remove(leftId);
            } else {
                rows.put(leftId, after);
            }
        }
        log.debug("Materialized {} changes of {} into {} output events",
                diff.changes().size(), diff.batchId(), events.size());
        return events;
    }

    /**
     * Current left-join view, one row per active left record in left-id order.
     */
    public List<OutputRow> snapshot() {
        return List.copyOf(rows.values());
    }

    public Optional<OutputRow> row(RecordId leftId) {
        return Optional.ofNullable(rows.get(leftId));
    }

    public Map<RecordId, OutputRow> asMap() {
        return Collections.unmodifiableMap(new TreeMap<>(rows));
    }

    public int size() {
        return rows.size();
    }

    private OutputRow fold(RecordId leftId, OutputRow current, List<AssignmentChange> changes) {
        OutputRow row = current;
        for (AssignmentChange change : changes) {
            switch (change.type()) {
                case LEFT_ADDED -> {
                    if (row != null) {
                        throw outOfSync(change, "left record is already materialized");
                    }
                    row = OutputRow.unmatched(leftId);
                }
                case LEFT_REMOVED -> {
                    if (row == null) {
                        throw outOfSync(change, "left record is not materialized");
                    }
                    row = null;
                }
                case PAIR_ADDED -> {
                    if (row == null || row.isMatched()) {
                        throw outOfSync(change, "left record is not materialized as unmatched");
                    }
                    row = OutputRow.matched(leftId, change.rightId(), change.confidence());
                }
                case PAIR_REMOVED -> {
                    if (row == null || !change.rightId().equals(row.rightId())) {
                        throw outOfSync(change, "pair is not materialized");
                    }
                    row = OutputRow.unmatched(leftId);
                }
                case CONFIDENCE_CHANGED -> {
                    if (row == null || !change.rightId().equals(row.rightId())) {
                        throw outOfSync(change, "pair is not materialized");
                    }
                    row = OutputRow.matched(leftId, change.rightId(), change.confidence());
                }
            }
        }
        return row;
    }

    private static void emit(OutputRow before, OutputRow after, List<OutputEvent> events) {
        if (Objects.equals(before, after)) {
            return;
        }
        if (after == null) {
            events.add(OutputEvent.retract(before));
            return;
        }
        if (before != null && before.isMatched() && !before.rightId().equals(after.rightId())) {
            events.add(OutputEvent.retract(before));
        }
        events.add(OutputEvent.upsert(after));
    }

    private static IllegalStateException outOfSync(AssignmentChange change, String reason) {
        return new IllegalStateException("Output view out of sync at " + change + ": " + reason);
    }
}
