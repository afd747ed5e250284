/**
 * Micrometer metrics for the notifier.
 *
 * <p>Pass a {@link infosquito.micrometer.MicrometerMetricsExporter} to
 * {@link infosquito.Infosquito.Builder#metrics(infosquito.spi.MetricsExporter)}.
 */
package infosquito.micrometer;
