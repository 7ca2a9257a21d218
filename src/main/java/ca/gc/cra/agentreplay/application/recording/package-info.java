/**
 * Recording API used by agents to populate traces.
 * <p><strong>Concurrency:</strong> One recorder per run; recorders are not thread-safe.</p>
 */
package ca.gc.cra.agentreplay.application.recording;
