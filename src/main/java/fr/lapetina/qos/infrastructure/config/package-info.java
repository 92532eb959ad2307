/**
 * YAML configuration of the QoS engine.
 *
 * <h2>Sections</h2>
 * <ul>
 *   <li>{@code recognition} - signature catalogue, flow retention and cleanup cadence</li>
 *   <li>{@code ingestion} - packet ring buffer size and wait strategy</li>
 *   <li>{@code execution} - device command timeout, parallelism and circuit breaker</li>
 *   <li>{@code sdn} - controller endpoint, concurrency, deadline and success threshold</li>
 *   <li>{@code metrics} - Prometheus prefix</li>
 * </ul>
 *
 * <p>{@link fr.lapetina.qos.infrastructure.config.ConfigLoader} can watch the file and notify
 * {@link fr.lapetina.qos.infrastructure.config.ConfigChangeListener}s after each accepted reload.
 */
package fr.lapetina.qos.infrastructure.config;
