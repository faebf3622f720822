/**
 * Actguard worker: Temporal entry point and the post-execution output handling it exposes.
 * <ul>
 *   <li>{@link com.actguard.worker.ActguardWorkerApplication} – worker bootstrap</li>
 *   <li>{@code service} – validation and masking as one configured service</li>
 *   <li>{@code activity} – JSON-string activity surface for workflows</li>
 * </ul>
 */
package com.actguard.worker;
