/**
 * Core domain model for QoS policies and their computed queue configuration.
 *
 * <p>All types in this package are immutable records or enums and safe to share between threads.
 *
 * <h2>Ownership</h2>
 * <ul>
 *   <li>{@link fr.lapetina.qos.domain.model.QosPolicy} owns an ordered list of
 *       {@link fr.lapetina.qos.domain.model.TrafficClass}</li>
 *   <li>{@link fr.lapetina.qos.domain.model.TrafficClass} owns an ordered list of
 *       {@link fr.lapetina.qos.domain.model.TrafficClassifier}</li>
 *   <li>{@link fr.lapetina.qos.domain.model.QueueConfiguration} pairs a class with its computed
 *       {@link fr.lapetina.qos.domain.model.QueueParameters} and
 *       {@link fr.lapetina.qos.domain.model.CongestionParameters}</li>
 * </ul>
 *
 * <h2>Units</h2>
 * <table border="1">
 *   <tr><th>Field</th><th>Unit</th></tr>
 *   <tr><td>bandwidth limit, min/max bandwidth, service rate</td><td>kbps</td></tr>
 *   <tr><td>burst</td><td>kb</td></tr>
 *   <tr><td>buffer size, queue limit, RED thresholds</td><td>packets</td></tr>
 *   <tr><td>ECN thresholds (FQ-CoDel target and interval)</td><td>microseconds</td></tr>
 * </table>
 */
package fr.lapetina.qos.domain.model;
