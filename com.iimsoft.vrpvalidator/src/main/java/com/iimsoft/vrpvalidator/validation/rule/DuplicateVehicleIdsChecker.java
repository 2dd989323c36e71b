package com.iimsoft.vrpvalidator.validation.rule;

import com.iimsoft.vrpvalidator.domain.Problem;
import com.iimsoft.vrpvalidator.domain.VehicleType;
import com.iimsoft.vrpvalidator.validation.ErrorCode;
import com.iimsoft.vrpvalidator.validation.RuleChecker;
import com.iimsoft.vrpvalidator.validation.ValidationError;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * E1004: vehicle ids must be unique across the whole fleet.
 *
 * 先把所有车辆类型的 vehicleIds 拍平成一个列表再查重，
 * 这样同一个 id 出现在两个不同类型里也能被发现。
 */
public class DuplicateVehicleIdsChecker implements RuleChecker {

    @Override
    public ErrorCode code() {
        return ErrorCode.E1004;
    }

    @Override
    public List<ValidationError> check(Problem problem) {
        List<VehicleSlot> slots = flatten(problem.getFleet().getVehicles());
        List<String> ids = slots.stream().map(s -> s.vehicleId).collect(Collectors.toList());

        List<ValidationError> errors = new ArrayList<>();
        for (Map.Entry<String, List<Integer>> e : IdOccurrences.duplicates(ids).entrySet()) {
            List<VehicleSlot> owners = e.getValue().stream().map(slots::get).collect(Collectors.toList());
            List<String> typeIds = owners.stream()
                    .map(s -> String.valueOf(s.typeId))
                    .distinct()
                    .collect(Collectors.toList());

            List<String> references = new ArrayList<>();
            references.add(e.getKey());
            references.addAll(typeIds);
            errors.add(new ValidationError(code(),
                    "vehicle id '" + e.getKey() + "' is used " + owners.size() + " times in vehicle types "
                            + typeIds.stream().map(t -> "'" + t + "'").collect(Collectors.joining(", ")),
                    owners.stream().map(VehicleSlot::path).collect(Collectors.joining(", ")),
                    references));
        }
        return errors;
    }

    private static List<VehicleSlot> flatten(List<VehicleType> types) {
        List<VehicleSlot> slots = new ArrayList<>();
        for (int t = 0; t < types.size(); t++) {
            VehicleType type = types.get(t);
            if (type == null) {
                continue;
            }
            List<String> vehicleIds = type.getVehicleIds();
            for (int v = 0; v < vehicleIds.size(); v++) {
                slots.add(new VehicleSlot(vehicleIds.get(v), type.getTypeId(), t, v));
            }
        }
        return slots;
    }

    private static final class VehicleSlot {
        private final String vehicleId;
        private final String typeId;
        private final int typeIndex;
        private final int vehicleIndex;

        private VehicleSlot(String vehicleId, String typeId, int typeIndex, int vehicleIndex) {
            this.vehicleId = vehicleId;
            this.typeId = typeId;
            this.typeIndex = typeIndex;
            this.vehicleIndex = vehicleIndex;
        }

        private String path() {
            return "fleet.vehicles[" + typeIndex + "].vehicleIds[" + vehicleIndex + "]";
        }
    }
}
