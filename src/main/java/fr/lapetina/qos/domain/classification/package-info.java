/**
 * Packet classification strategies.
 *
 * <p>Each {@link fr.lapetina.qos.domain.classification.PacketMatchStrategy} tests one kind of
 * criterion and treats an absent criterion as a wildcard. Strategies are stateless, so the
 * same instance is reused everywhere.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Name</th><th>Criterion</th><th>Wildcard</th></tr>
 *   <tr><td>{@code protocol}</td><td>{@code Protocol}</td><td>null, {@code ANY}</td></tr>
 *   <tr><td>{@code source-ip}, {@code destination-ip}</td><td>address or CIDR</td><td>null</td></tr>
 *   <tr><td>{@code source-port}, {@code destination-port}</td><td>port</td><td>null, 0</td></tr>
 *   <tr><td>{@code source-port-range}, {@code destination-port-range}</td><td>{@code PortRange}</td><td>null, 0-0</td></tr>
 *   <tr><td>{@code dscp}</td><td>name or code point</td><td>null</td></tr>
 *   <tr><td>{@code vlan}</td><td>VLAN id</td><td>null</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * CompositeMatchStrategy voice = ClassifierMatchers.fromClassifier(
 *         TrafficClassifier.builder().protocol(Protocol.UDP).destinationPorts(16384, 32767).build());
 * boolean isVoice = voice.matches(packet);
 * }</pre>
 */
package fr.lapetina.qos.domain.classification;
