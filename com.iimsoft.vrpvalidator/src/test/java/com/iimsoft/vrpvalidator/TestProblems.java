package com.iimsoft.vrpvalidator;

import com.iimsoft.vrpvalidator.domain.Fleet;
import com.iimsoft.vrpvalidator.domain.Job;
import com.iimsoft.vrpvalidator.domain.JobPlace;
import com.iimsoft.vrpvalidator.domain.JobTask;
import com.iimsoft.vrpvalidator.domain.Location;
import com.iimsoft.vrpvalidator.domain.Plan;
import com.iimsoft.vrpvalidator.domain.Problem;
import com.iimsoft.vrpvalidator.domain.TimeWindow;
import com.iimsoft.vrpvalidator.domain.VehicleShift;
import com.iimsoft.vrpvalidator.domain.VehicleType;

import java.util.Arrays;
import java.util.List;

/**
 * Small builders for problem definitions used across the tests.
 */
public final class TestProblems {

    public static final String DAY = "2020-07-04";

    private TestProblems() {
    }

    /** Window on {@link #DAY}, hours given as "HH:mm". */
    public static TimeWindow at(String from, String to) {
        return TimeWindow.of(DAY + "T" + from + ":00Z", DAY + "T" + to + ":00Z");
    }

    public static List<Integer> demand(Integer... values) {
        return Arrays.asList(values);
    }

    public static JobTask task(List<Integer> demand, TimeWindow... times) {
        return new JobTask(List.of(new JobPlace(new Location(52.52, 13.40), 60)), demand, Arrays.asList(times));
    }

    public static Job pickupDelivery(String id, JobTask pickup, JobTask delivery) {
        return new Job(id, List.of(pickup), List.of(delivery));
    }

    public static Job delivery(String id, TimeWindow... times) {
        return new Job(id, List.of(), List.of(task(demand(1), times)));
    }

    public static Job pickup(String id, TimeWindow... times) {
        return new Job(id, List.of(task(demand(1), times)), List.of());
    }

    public static VehicleType vehicleType(String typeId, List<String> vehicleIds, TimeWindow... shift) {
        return new VehicleType(typeId, "car", vehicleIds, demand(10), new VehicleShift(Arrays.asList(shift)));
    }

    public static VehicleType vehicleType(String typeId, String... vehicleIds) {
        return vehicleType(typeId, Arrays.asList(vehicleIds), at("08:00", "18:00"));
    }

    public static Problem problem(List<Job> jobs, List<VehicleType> vehicles) {
        return new Problem(new Plan(jobs), new Fleet(vehicles));
    }

    public static Problem jobs(Job... jobs) {
        return problem(Arrays.asList(jobs), List.of(vehicleType("car", "car_1")));
    }

    public static Problem fleet(VehicleType... types) {
        return problem(List.of(delivery("job1", at("09:00", "10:00"))), Arrays.asList(types));
    }
}
