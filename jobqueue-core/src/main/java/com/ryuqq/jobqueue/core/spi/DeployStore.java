package com.ryuqq.jobqueue.core.spi;

import com.ryuqq.jobqueue.core.resource.Deployment;
import com.ryuqq.jobqueue.core.resource.DeploymentStatus;
import com.ryuqq.jobqueue.core.resource.Service;

import java.util.List;
import java.util.Map;

/**
 * Durable storage SPI for services and deployment records.
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: called concurrently from several workers</li>
 *   <li>Failures are reported as {@link StoreException}</li>
 * </ul>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public interface DeployStore {

    /**
     * Field name for the image reference in {@link #updateService(long, Map)}.
     */
    String FIELD_IMAGE = "image";

    /**
     * Retrieves a service.
     *
     * @param serviceId the service id
     * @return the service
     * @throws StoreException if the service does not exist or cannot be read
     */
    Service getService(long serviceId);

    /**
     * Applies field updates to a service.
     *
     * @param serviceId the service id
     * @param fieldUpdates field name to new value (e.g. {@link #FIELD_IMAGE})
     * @throws StoreException if the service does not exist, a field is unknown or the update fails
     */
    void updateService(long serviceId, Map<String, String> fieldUpdates);

    /**
     * Persists a new deployment record and assigns its identifier.
     *
     * @param deployment the record to persist (id is ignored)
     * @return the persisted record carrying the assigned id
     * @throws StoreException if the record cannot be stored
     */
    Deployment createDeployment(Deployment deployment);

    /**
     * Updates the status of a deployment record.
     *
     * @param deploymentId the deployment id
     * @param status the new status
     * @param reason reason text, or null to keep the stored reason
     * @throws StoreException if the record does not exist or cannot be updated
     */
    void updateDeploymentStatus(long deploymentId, DeploymentStatus status, String reason);

    /**
     * Lists the deployments of a service, newest first.
     *
     * @param serviceId the service id
     * @return deployments ordered by creation, newest first (may be empty)
     */
    List<Deployment> listDeployments(long serviceId);
}
