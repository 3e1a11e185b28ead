/**
 * Typed trace contracts compiled into structured loggers.
 *
 * <p>A contract is an interface extending {@link com.tracecontract.core.TraceContract} (or an
 * explicit {@link com.tracecontract.core.ContractSpec}) whose operations each declare a level,
 * a message template and typed parameters. The {@link com.tracecontract.core.ContractRegistry}
 * compiles a contract once: templates are validated against parameter names
 * ({@link com.tracecontract.core.TemplateValidator}), parameters are split into exception slot
 * and context fields ({@link com.tracecontract.core.ParameterClassifier}), and the resulting
 * dispatch table formats records ({@link com.tracecontract.core.RecordFormatter}) for a
 * {@link com.tracecontract.core.LogSink}. Operations returning
 * {@link com.tracecontract.core.Activity} emit a start record and a timed end record.
 *
 * @see com.tracecontract.core.Tracer
 */
package com.tracecontract.core;
