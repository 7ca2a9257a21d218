/**
 * Application layer for recording, replaying, and diffing agent traces.
 * <p><strong>Role:</strong> Hosts the engines and the ports they depend on; no file formats live here.</p>
 * <p><strong>Concurrency:</strong> Single-threaded and synchronous; engines read trace snapshots.</p>
 */
package ca.gc.cra.agentreplay.application;
