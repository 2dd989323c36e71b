package com.iimsoft.vrpvalidator.domain;

/**
 * 已解析的问题定义：plan（作业）+ fleet（车队）。校验期间不可变。
 */
public final class Problem {

    private final Plan plan;
    private final Fleet fleet;

    public Problem(Plan plan, Fleet fleet) {
        this.plan = plan == null ? new Plan(null) : plan;
        this.fleet = fleet == null ? new Fleet(null) : fleet;
    }

    public Plan getPlan() {
        return plan;
    }

    public Fleet getFleet() {
        return fleet;
    }
}
