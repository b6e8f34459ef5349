package com.alertrelay.core.model;

public record GeoLocation(
        double latitude,
        double longitude,
        String address,
        String city,
        String state,
        String zipCode
) {
    public static GeoLocation of(double latitude, double longitude) {
        return new GeoLocation(latitude, longitude, null, null, null, null);
    }
}
