/**
 * {@link ca.gc.cra.keagen.application.port.DocumentSink} implementations for files and character streams.
 */
package ca.gc.cra.keagen.infrastructure.output;
