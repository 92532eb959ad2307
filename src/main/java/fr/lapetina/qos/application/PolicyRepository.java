package fr.lapetina.qos.application;

import fr.lapetina.qos.domain.model.QosPolicy;

import java.util.List;
import java.util.Optional;

/**
 * Storage of QoS policies, implemented outside the library.
 */
public interface PolicyRepository {

    Optional<QosPolicy> findById(String policyId);

    List<QosPolicy> findAll();

    QosPolicy save(QosPolicy policy);

    boolean deleteById(String policyId);
}
