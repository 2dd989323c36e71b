package com.iimsoft.vrpvalidator.domain;

import java.util.List;

/**
 * A group of identical vehicles.
 *
 * IMPORTANT: vehicleIds must be unique across the whole fleet, not only inside one type.
 */
public final class VehicleType {

    private final String typeId;
    private final String profile;
    private final List<String> vehicleIds;
    private final List<Integer> capacity;
    private final VehicleShift shift;

    public VehicleType(String typeId, String profile, List<String> vehicleIds,
                       List<Integer> capacity, VehicleShift shift) {
        this.typeId = typeId;
        this.profile = profile;
        this.vehicleIds = DomainLists.copyOf(vehicleIds);
        this.capacity = DomainLists.copyOf(capacity);
        this.shift = shift == null ? new VehicleShift(null) : shift;
    }

    public String getTypeId() {
        return typeId;
    }

    public String getProfile() {
        return profile;
    }

    public List<String> getVehicleIds() {
        return vehicleIds;
    }

    public List<Integer> getCapacity() {
        return capacity;
    }

    public VehicleShift getShift() {
        return shift;
    }

    @Override
    public String toString() {
        return typeId;
    }
}
