/**
 * Application recognition over live flows.
 *
 * <h2>Methods and fusion weights</h2>
 * <table>
 *   <caption>Recognition methods</caption>
 *   <tr><th>Method</th><th>Raw confidence</th><th>Weight</th><th>Threshold applied</th></tr>
 *   <tr><td>payload</td><td>matched patterns / patterns, at most 0.9</td><td>0.4</td><td>no</td></tr>
 *   <tr><td>header</td><td>matched headers / headers</td><td>0.3</td><td>yes</td></tr>
 *   <tr><td>behavioral</td><td>matched descriptors / descriptors</td><td>0.2</td><td>yes</td></tr>
 *   <tr><td>port</td><td>0.6</td><td>0.1</td><td>no</td></tr>
 * </table>
 *
 * <p>Weighted confidences are summed per application; the best sum (capped at 1.0) wins and
 * ties keep the application reported first. Signatures come from
 * {@code application-signatures.yaml} through {@link fr.lapetina.qos.infrastructure.recognition.SignatureLoader}.
 *
 * @see fr.lapetina.qos.infrastructure.recognition.ApplicationRecognitionService
 */
package fr.lapetina.qos.infrastructure.recognition;
