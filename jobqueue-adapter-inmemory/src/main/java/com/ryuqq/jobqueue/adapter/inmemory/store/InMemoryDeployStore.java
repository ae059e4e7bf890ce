package com.ryuqq.jobqueue.adapter.inmemory.store;

import com.ryuqq.jobqueue.core.resource.Deployment;
import com.ryuqq.jobqueue.core.resource.DeploymentStatus;
import com.ryuqq.jobqueue.core.resource.Service;
import com.ryuqq.jobqueue.core.spi.DeployStore;
import com.ryuqq.jobqueue.core.spi.StoreException;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link DeployStore} for testing and reference purposes.
 *
 * <p><strong>Supported service fields:</strong> {@code image}, {@code name}.
 * Any other field in {@link #updateService(long, Map)} is rejected.</p>
 *
 * <p>Deployments are listed newest first (by creation time, then id).</p>
 *
 * @author Jobqueue Team
 * @since 1.0.0
 */
public class InMemoryDeployStore implements DeployStore {

    private static final String FIELD_NAME = "name";

    private final ConcurrentHashMap<Long, Service> services = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Deployment> deployments = new ConcurrentHashMap<>();
    private final AtomicLong serviceSequence = new AtomicLong();
    private final AtomicLong deploymentSequence = new AtomicLong();

    /**
     * 서비스 등록.
     *
     * @param projectId 프로젝트 ID
     * @param name 서비스 이름
     * @param image 현재 이미지
     * @return ID가 부여된 서비스
     */
    public Service addService(long projectId, String name, String image) {
        Service service = new Service(serviceSequence.incrementAndGet(), projectId, name, image);
        services.put(service.id(), service);
        return service;
    }

    @Override
    public Service getService(long serviceId) {
        Service service = services.get(serviceId);
        if (service == null) {
            throw new StoreException("service " + serviceId + " not found");
        }
        return service;
    }

    @Override
    public void updateService(long serviceId, Map<String, String> fieldUpdates) {
        if (fieldUpdates == null || fieldUpdates.isEmpty()) {
            throw new IllegalArgumentException("fieldUpdates cannot be null or empty");
        }
        for (String field : fieldUpdates.keySet()) {
            if (!FIELD_IMAGE.equals(field) && !FIELD_NAME.equals(field)) {
                throw new StoreException("unknown service field: " + field);
            }
        }
        Service updated = services.computeIfPresent(serviceId, (id, current) -> {
            Service next = current;
            if (fieldUpdates.containsKey(FIELD_IMAGE)) {
                next = next.withImage(fieldUpdates.get(FIELD_IMAGE));
            }
            if (fieldUpdates.containsKey(FIELD_NAME)) {
                next = new Service(next.id(), next.projectId(), fieldUpdates.get(FIELD_NAME), next.image());
            }
            return next;
        });
        if (updated == null) {
            throw new StoreException("service " + serviceId + " not found");
        }
    }

    @Override
    public Deployment createDeployment(Deployment deployment) {
        if (deployment == null) {
            throw new IllegalArgumentException("deployment cannot be null");
        }
        Deployment stored = deployment.withId(deploymentSequence.incrementAndGet());
        deployments.put(stored.id(), stored);
        return stored;
    }

    @Override
    public void updateDeploymentStatus(long deploymentId, DeploymentStatus status, String reason) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        Deployment updated = deployments.computeIfPresent(deploymentId,
            (id, current) -> current.withStatus(status, reason));
        if (updated == null) {
            throw new StoreException("deployment " + deploymentId + " not found");
        }
    }

    @Override
    public List<Deployment> listDeployments(long serviceId) {
        return deployments.values().stream()
            .filter(deployment -> deployment.serviceId() == serviceId)
            .sorted(Comparator.comparing(Deployment::createdAt).thenComparingLong(Deployment::id).reversed())
            .collect(Collectors.toList());
    }

    public Optional<Deployment> findDeployment(long deploymentId) {
        return Optional.ofNullable(deployments.get(deploymentId));
    }
}
