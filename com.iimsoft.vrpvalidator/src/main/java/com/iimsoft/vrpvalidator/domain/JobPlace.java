package com.iimsoft.vrpvalidator.domain;

/**
 * 作业地点：位置 + 服务时长（秒）。校验只关心结构，不使用坐标。
 */
public final class JobPlace {

    private final Location location;
    private final double duration;
    private final String tag;

    public JobPlace(Location location, double duration, String tag) {
        this.location = location;
        this.duration = duration;
        this.tag = tag;
    }

    public JobPlace(Location location, double duration) {
        this(location, duration, null);
    }

    public Location getLocation() {
        return location;
    }

    public double getDuration() {
        return duration;
    }

    public String getTag() {
        return tag;
    }
}
