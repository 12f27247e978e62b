/**
 * Logging engine configuration: the immutable {@link ca.gc.cra.logvault.config.LogConfig}, its YAML loader and
 * the duration syntax shared by both.
 */
package ca.gc.cra.logvault.config;
