/**
 * Extension points implemented by store adapters and metrics bridges.
 *
 * @see alertgate.spi.AlertQueries
 * @see alertgate.spi.CommandExecutor
 * @see alertgate.spi.ConnectionProvider
 * @see alertgate.spi.MetricsExporter
 */
package alertgate.spi;
