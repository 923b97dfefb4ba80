/**
 * Infrastructure adapters: JSON serialization and document output.
 * <p><strong>Role:</strong> Driven side of the hexagon; implements {@code application.port} interfaces.</p>
 * <p><strong>Concurrency:</strong> Adapters are created and used on the CLI thread.</p>
 */
package ca.gc.cra.keagen.infrastructure;
