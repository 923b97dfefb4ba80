/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Pipeline role:</strong> Rejects malformed values before the DHCPv4 model is built or an output file
 * is touched.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.keagen.validation;
