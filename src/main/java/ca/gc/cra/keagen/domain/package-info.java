/**
 * Core domain model for Kea configuration generation.
 * <p><strong>Role:</strong> Domain layer; no infrastructure dependencies beyond SLF4J.</p>
 * <p><strong>Concurrency:</strong> Model aggregates are mutable and single-threaded; value types are immutable.</p>
 */
package ca.gc.cra.keagen.domain;
