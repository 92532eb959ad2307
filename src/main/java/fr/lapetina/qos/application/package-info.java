/**
 * Use cases orchestrating validation, command generation, execution and persistence.
 *
 * <h2>Results</h2>
 * <p>Apply, remove and deploy calls never throw domain errors: they return a
 * {@link fr.lapetina.qos.application.QosConfigurationResult} carrying the
 * {@link fr.lapetina.qos.domain.model.ErrorType}. Allocation queries throw.
 *
 * <h2>Storage</h2>
 * <p>Policies, devices and interface associations are read and written through the
 * repository interfaces of this package; the library ships no implementation.
 */
package fr.lapetina.qos.application;
