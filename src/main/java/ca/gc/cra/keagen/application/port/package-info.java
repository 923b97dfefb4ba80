/**
 * Ports connecting the generate use case to output adapters.
 */
package ca.gc.cra.keagen.application.port;
