/**
 * Configuration records, defaults, YAML loading and the composition root.
 * <p>Precedence is CLI &gt; YAML &gt; {@link ca.gc.cra.brownian.config.DefaultsForMode}.</p>
 */
package ca.gc.cra.brownian.config;
