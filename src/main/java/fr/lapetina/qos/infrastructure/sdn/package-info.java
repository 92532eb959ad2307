/**
 * Centralised QoS through an SDN controller.
 *
 * <h2>Model</h2>
 * <p>{@link fr.lapetina.qos.infrastructure.sdn.SdnPolicy} turns a QoS policy into queues, meters and
 * {@link fr.lapetina.qos.infrastructure.sdn.OpenFlowRule}s whose priorities follow
 * {@link fr.lapetina.qos.infrastructure.sdn.FlowPriority}.
 *
 * <h2>Controllers</h2>
 * <p>{@link fr.lapetina.qos.infrastructure.sdn.ControllerPayloads} shapes ONOS and OpenDaylight requests;
 * {@link fr.lapetina.qos.infrastructure.sdn.ControllerClient} carries them.
 * {@link fr.lapetina.qos.infrastructure.sdn.JdkControllerClient} is the default transport.
 *
 * <h2>Deployment</h2>
 * <p>{@link fr.lapetina.qos.infrastructure.sdn.SdnIntegrationService} deploys on a bounded pool under a deadline
 * and reports per switch in a {@link fr.lapetina.qos.infrastructure.sdn.DeploymentReport}.
 */
package fr.lapetina.qos.infrastructure.sdn;
