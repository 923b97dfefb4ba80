/**
 * Use cases that turn generator configuration into Kea documents.
 * <p>Workflows are not thread-safe; create a fresh instance per CLI invocation.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.keagen.application.pipeline;
