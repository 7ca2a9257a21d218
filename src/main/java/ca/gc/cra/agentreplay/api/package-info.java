/**
 * Command-line entry points for viewing, replaying, diffing, and exporting recorded traces.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, merges YAML settings, configures
 * logging and metrics, and invokes the replay, diff, and export use cases.</p>
 * <p><strong>Output:</strong> Results go to stdout through {@link ca.gc.cra.agentreplay.api.CliPrinter}; logs go to
 * stderr.</p>
 */
package ca.gc.cra.agentreplay.api;
