/**
 * Out-of-process {@link alertgate.spi.CommandExecutor} that shells out to a
 * {@code run-operation} command line.
 */
package alertgate.command;
