/**
 * Generator configuration: defaults, YAML loading, CLI precedence and the built-in example.
 * <p><strong>Role:</strong> Application bootstrap layer feeding {@link ca.gc.cra.keagen.application.pipeline.GenerateUseCase}.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Values pass through {@code ca.gc.cra.keagen.validation} before use.</p>
 */
package ca.gc.cra.keagen.config;
