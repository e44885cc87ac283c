package com.gocomet.ridepool.routing.model;

public enum WaypointType {
    PICKUP,
    DROPOFF
}
