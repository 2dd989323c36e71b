package com.iimsoft.vrpvalidator.validation.rule;

import com.iimsoft.vrpvalidator.domain.Problem;
import com.iimsoft.vrpvalidator.domain.VehicleType;
import com.iimsoft.vrpvalidator.validation.ErrorCode;
import com.iimsoft.vrpvalidator.validation.RuleChecker;
import com.iimsoft.vrpvalidator.validation.ValidationError;
import com.iimsoft.vrpvalidator.validation.interval.IntervalChecker;
import com.iimsoft.vrpvalidator.validation.interval.IntervalViolation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * E1005: shift time windows of every vehicle type. Same interval rules as job time windows.
 */
public class VehicleShiftTimeChecker implements RuleChecker {

    private final IntervalChecker intervalChecker;

    public VehicleShiftTimeChecker() {
        this(new IntervalChecker());
    }

    public VehicleShiftTimeChecker(IntervalChecker intervalChecker) {
        this.intervalChecker = Objects.requireNonNull(intervalChecker, "intervalChecker");
    }

    @Override
    public ErrorCode code() {
        return ErrorCode.E1005;
    }

    @Override
    public List<ValidationError> check(Problem problem) {
        List<ValidationError> errors = new ArrayList<>();
        List<VehicleType> types = problem.getFleet().getVehicles();
        for (int i = 0; i < types.size(); i++) {
            VehicleType type = types.get(i);
            if (type == null) {
                continue;
            }
            String timesPath = "fleet.vehicles[" + i + "].shift.times";
            for (IntervalViolation v : intervalChecker.check(type.getShift().getTimes())) {
                errors.add(ValidationError.of(code(),
                        "vehicle type '" + type.getTypeId() + "' shift: " + v.describe(),
                        TimePaths.of(timesPath, v), String.valueOf(type.getTypeId())));
            }
        }
        return errors;
    }
}
