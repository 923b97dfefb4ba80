/**
 * Logging bootstrap for the CLI; code elsewhere logs through SLF4J directly.
 */
package ca.gc.cra.keagen.logging;
