/**
 * Root API for alertgate: alert suppression and chunked dispatch of state updates.
 *
 * <h2>Core Design</h2>
 * <p>Pending alerts and their send history are read through {@link alertgate.spi.AlertQueries}.
 * The {@linkplain alertgate.suppression.SuppressionEngine suppression engine} withholds alerts
 * whose logical check was already notified; the rest go to the notifiers. State changes
 * ({@code update_sent_alerts}, {@code update_skipped_alerts}) are pushed back through a
 * {@linkplain alertgate.dispatch.ChunkedDispatcher chunked dispatcher}, which bounds each remote
 * call to a fixed number of alert ids and reports failures per chunk.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>alertgate-core</b>: model, suppression, dispatch, SPIs (zero external deps)</li>
 *   <li><b>alertgate-jdbc</b>: JDBC alert queries and in-process command executor</li>
 *   <li><b>alertgate-micrometer</b>: Micrometer metrics bridge</li>
 *   <li><b>alertgate-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Manual Wiring</h2>
 * <pre>{@code
 * var dispatcher = ChunkedDispatcher.builder()
 *     .commandExecutor(RunOperationCommandExecutor.builder()
 *         .projectDir(new File("/srv/dbt/elementary"))
 *         .build())
 *     .build();
 *
 * var engine   = new SuppressionEngine();
 * var pending  = queries.queryPendingAlerts(AlertKind.TEST);
 * var lastSent = queries.queryLastSentTimes(AlertKind.TEST);
 * List<String> suppressed = engine.suppress(pending, lastSent);
 *
 * DispatchOutcome<String> outcome = dispatcher.dispatch(
 *     DispatchRequest.builder("update_sent_alerts", sentIds)
 *         .fixedArg("table_name", "alerts")
 *         .build());
 * if (!outcome.isSuccess()) {
 *   retry(outcome.failedItems());
 * }
 * }</pre>
 *
 * @see alertgate.AlertsApi
 * @see alertgate.AlertGateConfig
 */
package alertgate;
