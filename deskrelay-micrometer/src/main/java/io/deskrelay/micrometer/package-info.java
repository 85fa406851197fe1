/**
 * Micrometer bridge for deskrelay metrics.
 *
 * @see io.deskrelay.micrometer.MicrometerMetricsExporter
 */
package io.deskrelay.micrometer;
