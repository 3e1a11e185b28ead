package com.tracecontract.core;

import java.util.Map;

/**
 * Describes an activity that has just started, as seen by {@link ActivityListener}s.
 *
 * @param ownerName     logger name of the contract owner
 * @param operationName name of the operation that started the activity
 * @param name          formatted activity name (the operation's rendered message)
 * @param level         activity level
 * @param context       structured context of the activity
 */
public record ActivityInfo(
        String ownerName,
        String operationName,
        String name,
        LogLevel level,
        Map<String, Object> context
) {

    public ActivityInfo {
        context = context == null ? Map.of() : context;
    }
}
