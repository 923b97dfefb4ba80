/**
 * Command-line adapters: the {@code keagen} dispatcher, the {@code generate} and {@code example} commands,
 * and shared argument parsing and console helpers.
 *
 * <p>Commands return {@link ca.gc.cra.keagen.api.ExitCode} values; only {@code main} methods exit the JVM.</p>
 */
package ca.gc.cra.keagen.api;
