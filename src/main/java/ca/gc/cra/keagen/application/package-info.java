/**
 * Application layer orchestration for the Kea configuration generator.
 * <p><strong>Role:</strong> Hosts the generate use case and the ports it writes through.</p>
 * <p><strong>Concurrency:</strong> Single-threaded; each CLI run owns its model exclusively.</p>
 */
package ca.gc.cra.keagen.application;
