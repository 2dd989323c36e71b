package com.iimsoft.vrpvalidator.domain;

import java.util.List;

/**
 * A single pickup or delivery of a job.
 *
 * demand 按维度排列（例如 [重量, 体积]），times 为该任务可选的时间窗列表。
 */
public final class JobTask {

    private final List<JobPlace> places;
    private final List<Integer> demand;
    private final List<TimeWindow> times;
    private final String tag;

    public JobTask(List<JobPlace> places, List<Integer> demand, List<TimeWindow> times, String tag) {
        this.places = DomainLists.copyOf(places);
        this.demand = DomainLists.copyOf(demand);
        this.times = DomainLists.copyOf(times);
        this.tag = tag;
    }

    public JobTask(List<JobPlace> places, List<Integer> demand, List<TimeWindow> times) {
        this(places, demand, times, null);
    }

    public List<JobPlace> getPlaces() {
        return places;
    }

    public List<Integer> getDemand() {
        return demand;
    }

    public List<TimeWindow> getTimes() {
        return times;
    }

    public String getTag() {
        return tag;
    }
}
