package com.iimsoft.vrpvalidator.domain;

import java.util.List;

public final class Job {

    private final String id;
    private final List<JobTask> pickups;
    private final List<JobTask> deliveries;

    public Job(String id, List<JobTask> pickups, List<JobTask> deliveries) {
        this.id = id;
        this.pickups = DomainLists.copyOf(pickups);
        this.deliveries = DomainLists.copyOf(deliveries);
    }

    public String getId() {
        return id;
    }

    public List<JobTask> getPickups() {
        return pickups;
    }

    public List<JobTask> getDeliveries() {
        return deliveries;
    }

    public List<JobTask> getTasks(TaskRole role) {
        return role == TaskRole.PICKUP ? pickups : deliveries;
    }

    @Override
    public String toString() {
        return id;
    }
}
