/**
 * Configuration loading and composition for the command-line tool.
 * <p><strong>Role:</strong> Merges defaults, YAML, and CLI settings into typed per-command configs and wires
 * adapters.</p>
 * <p><strong>Security:</strong> Paths are validated before any file is opened.</p>
 */
package ca.gc.cra.agentreplay.config;
