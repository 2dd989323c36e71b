package com.iimsoft.vrpvalidator.domain;

import java.util.List;

public final class Fleet {

    private final List<VehicleType> vehicles;

    public Fleet(List<VehicleType> vehicles) {
        this.vehicles = DomainLists.copyOf(vehicles);
    }

    public List<VehicleType> getVehicles() {
        return vehicles;
    }
}
