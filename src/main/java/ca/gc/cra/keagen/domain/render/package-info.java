/**
 * Render outcomes shared by the domain model and its callers.
 */
package ca.gc.cra.keagen.domain.render;
