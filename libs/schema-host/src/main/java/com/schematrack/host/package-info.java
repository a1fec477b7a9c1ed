/**
 * Schema reconciliation API of the host data-access layer.
 *
 * <p>The host synchronizes entity schemas through two pluggable strategies:
 *
 * <ul>
 *   <li>{@link com.schematrack.host.EntitySynchronizer}: synchronizes one entity; exposed through
 *       {@link com.schematrack.host.SchemaReconciler#entityExtensionPoint()}
 *   <li>{@link com.schematrack.host.PassSynchronizer}: runs one aggregate pass over a batch of
 *       entities; exposed through {@link com.schematrack.host.SchemaReconciler#passExtensionPoint()}
 * </ul>
 *
 * <p>Both extension points accept decorators that wrap the default behavior. Failures during a pass
 * are accumulated on the pass's error channel ({@link com.schematrack.host.ReconcilePass}) rather
 * than thrown to the caller.
 */
package com.schematrack.host;
