/**
 * Decides which pending alerts are duplicates of an already sent notification.
 *
 * <p>{@link alertgate.suppression.SuppressionEngine} applies a
 * {@link alertgate.suppression.SuppressionPolicy} to a pending alert list and a
 * {@link alertgate.model.LastSentRecord} snapshot of the same kind.
 * {@link alertgate.suppression.AlertDeduplicator} collapses repeated occurrences of one check
 * within a run.
 */
package alertgate.suppression;
