/**
 * Bounded async buffer between producers and the destination sink.
 */
package ca.gc.cra.logvault.application.pipeline;
