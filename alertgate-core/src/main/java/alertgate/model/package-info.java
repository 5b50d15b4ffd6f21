/**
 * Value types shared by the suppression engine, the dispatcher and the store adapters.
 *
 * @see alertgate.model.Alert
 * @see alertgate.model.LastSentRecord
 * @see alertgate.model.AlertStatus
 */
package alertgate.model;
