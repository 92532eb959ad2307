/**
 * Vendor command generation and device execution.
 *
 * <h2>Generation</h2>
 * <p>{@link fr.lapetina.qos.infrastructure.adapter.VendorAdapter} implementations turn a
 * {@link fr.lapetina.qos.infrastructure.adapter.QosCommandRequest} into an ordered list of CLI lines:
 * <ul>
 *   <li>{@link fr.lapetina.qos.infrastructure.adapter.CiscoIosAdapter}: MQC class-maps and policy-map</li>
 *   <li>{@link fr.lapetina.qos.infrastructure.adapter.JuniperJunosAdapter}: class-of-service {@code set} statements</li>
 *   <li>{@link fr.lapetina.qos.infrastructure.adapter.LinuxTcAdapter}: HTB tree with u32 filters</li>
 * </ul>
 * Adapters are stateless and never touch a device.
 *
 * <h2>Execution</h2>
 * <p>{@link fr.lapetina.qos.infrastructure.adapter.CommandExecutionService} hands batches to an external
 * {@link fr.lapetina.qos.infrastructure.adapter.CommandExecutor} with a per-batch timeout and a
 * per-device {@link fr.lapetina.qos.infrastructure.adapter.CircuitBreaker}.
 */
package fr.lapetina.qos.infrastructure.adapter;
