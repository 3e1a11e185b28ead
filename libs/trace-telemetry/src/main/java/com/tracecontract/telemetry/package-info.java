/**
 * Activity listeners publishing trace activities to OpenTelemetry and Micrometer. Register them
 * with {@link com.tracecontract.core.Tracer#addActivityListener}.
 */
package com.tracecontract.telemetry;
