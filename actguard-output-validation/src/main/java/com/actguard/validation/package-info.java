/**
 * Output schema validation for completed action executions.
 * <ul>
 *   <li>{@link com.actguard.validation.OutputSchemaValidator} – runner envelope, then action content</li>
 *   <li>{@link com.actguard.validation.SchemaValidationEngine} – pluggable JSON Schema engine; default is networknt</li>
 *   <li>{@link com.actguard.validation.ValidationErrorPayload} – error result stored on failed executions</li>
 * </ul>
 */
package com.actguard.validation;
