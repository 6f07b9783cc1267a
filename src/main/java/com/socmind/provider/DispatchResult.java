package com.socmind.provider;

import com.socmind.core.model.ActionRecord;

import java.util.List;

/**
 * Outcome of dispatching one group.
 *
 * @param groupNumber ordinal of the group within the task
 * @param records     one record per dispatched step, in plan order
 * @param elapsedMs   wall-clock time spent waiting on the whole group
 */
public record DispatchResult(
    int groupNumber,
    List<ActionRecord> records,
    long elapsedMs
) {

    public DispatchResult {
        records = List.copyOf(records);
    }

    public boolean allSucceeded() {
        return records.stream().allMatch(ActionRecord::succeeded);
    }

    public List<ActionRecord> failures() {
        return records.stream().filter(r -> !r.succeeded()).toList();
    }
}
