/**
 * Action-execution model shared by output validation and secret masking.
 *
 * <ul>
 *   <li>{@link com.actguard.execution.ExecutionStatus} – execution lifecycle status (JSON: lowercase name)</li>
 *   <li>{@link com.actguard.execution.model} – execution record: action (output schema) and runner (output key, envelope schema)</li>
 *   <li>{@link com.actguard.execution.schema} – {@link com.actguard.execution.schema.SchemaClassifier#classify classify}
 *       a raw output schema into {@link com.actguard.execution.schema.WellFormedSchema} or
 *       {@link com.actguard.execution.schema.MalformedSchema}</li>
 *   <li>{@link com.actguard.execution.ActionExecutionJson} – {@code fromJson}/{@code toJson} and plain-value JSON helpers</li>
 * </ul>
 */
package com.actguard.execution;
