/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Observability:</strong> No logging; failures surface as {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.agentreplay.validation;
