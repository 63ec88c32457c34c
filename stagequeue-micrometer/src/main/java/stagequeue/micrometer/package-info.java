/**
 * Micrometer bridge for exporting stage queue metrics.
 *
 * @see stagequeue.micrometer.MicrometerMetricsExporter
 */
package stagequeue.micrometer;
