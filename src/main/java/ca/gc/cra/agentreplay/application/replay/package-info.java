/**
 * Step-through replay of recorded traces.
 * <p><strong>Concurrency:</strong> Engines hold a mutable cursor and are confined to one caller.</p>
 */
package ca.gc.cra.agentreplay.application.replay;
