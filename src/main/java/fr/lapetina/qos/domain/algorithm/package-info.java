/**
 * Queue algorithm engine.
 *
 * <p>Each {@link fr.lapetina.qos.domain.algorithm.QueueAlgorithm} turns a policy into one
 * {@link fr.lapetina.qos.domain.model.QueueConfiguration} per class. All implementations are
 * pure functions and validate the policy before producing anything.
 *
 * <h2>Available Algorithms</h2>
 * <table border="1">
 *   <tr><th>Type</th><th>Scheduling</th><th>Congestion</th></tr>
 *   <tr><td>{@code cbwfq}</td><td>guarantee + weighted share</td><td>WRED when DSCP set, else tail-drop</td></tr>
 *   <tr><td>{@code llq}</td><td>strict priority for priority &gt;= 5, CBWFQ for the rest</td><td>tail-drop on priority queues</td></tr>
 *   <tr><td>{@code fq_codel}</td><td>per-flow fair queuing, priority-tiered target delay</td><td>ECN</td></tr>
 *   <tr><td>{@code drr}</td><td>deficit round robin quantum</td><td>RED for priority &gt;= 5, else tail-drop</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * QueueAlgorithm algorithm = AlgorithmFactory.create(QueueAlgorithmType.LLQ);
 * List<QueueConfiguration> queues = algorithm.calculate(policy);
 * }</pre>
 */
package fr.lapetina.qos.domain.algorithm;
