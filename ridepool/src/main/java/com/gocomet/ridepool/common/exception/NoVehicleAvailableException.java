package com.gocomet.ridepool.common.exception;

public class NoVehicleAvailableException extends ConflictException {
    public NoVehicleAvailableException(int passengers, int luggageUnits) {
        super(String.format("No available vehicles for %d passenger(s) and %d luggage unit(s) at the moment",
                passengers, luggageUnits));
    }
}
