package com.iimsoft.vrpvalidator.domain;

import java.util.List;

public final class Plan {

    private final List<Job> jobs;

    public Plan(List<Job> jobs) {
        this.jobs = DomainLists.copyOf(jobs);
    }

    public List<Job> getJobs() {
        return jobs;
    }
}
