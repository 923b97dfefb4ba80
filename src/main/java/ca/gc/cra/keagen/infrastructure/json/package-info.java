/**
 * Streaming JSON serialization of rendered documents built on jackson-core.
 */
package ca.gc.cra.keagen.infrastructure.json;
