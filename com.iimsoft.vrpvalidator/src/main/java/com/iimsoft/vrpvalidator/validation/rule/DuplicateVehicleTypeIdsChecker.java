package com.iimsoft.vrpvalidator.validation.rule;

import com.iimsoft.vrpvalidator.domain.Problem;
import com.iimsoft.vrpvalidator.validation.ErrorCode;
import com.iimsoft.vrpvalidator.validation.RuleChecker;
import com.iimsoft.vrpvalidator.validation.ValidationError;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * E1003: vehicle type ids must be unique in the fleet.
 */
public class DuplicateVehicleTypeIdsChecker implements RuleChecker {

    @Override
    public ErrorCode code() {
        return ErrorCode.E1003;
    }

    @Override
    public List<ValidationError> check(Problem problem) {
        List<String> typeIds = problem.getFleet().getVehicles().stream()
                .map(type -> type == null ? null : type.getTypeId())
                .collect(Collectors.toList());

        List<ValidationError> errors = new ArrayList<>();
        for (Map.Entry<String, List<Integer>> e : IdOccurrences.duplicates(typeIds).entrySet()) {
            String entries = e.getValue().stream()
                    .map(i -> "fleet.vehicles[" + i + "]")
                    .collect(Collectors.joining(", "));
            errors.add(ValidationError.of(code(),
                    "vehicle type id '" + e.getKey() + "' is defined " + e.getValue().size() + " times: " + entries,
                    e.getValue().stream().map(i -> "fleet.vehicles[" + i + "].typeId").collect(Collectors.joining(", ")),
                    e.getKey()));
        }
        return errors;
    }
}
