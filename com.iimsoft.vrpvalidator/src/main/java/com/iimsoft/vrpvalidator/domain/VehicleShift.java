package com.iimsoft.vrpvalidator.domain;

import java.util.List;

/**
 * 车辆可工作的时间段，和作业时间窗使用同一套规则校验。
 */
public final class VehicleShift {

    private final List<TimeWindow> times;

    public VehicleShift(List<TimeWindow> times) {
        this.times = DomainLists.copyOf(times);
    }

    public List<TimeWindow> getTimes() {
        return times;
    }
}
