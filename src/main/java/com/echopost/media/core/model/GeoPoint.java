package com.echopost.media.core.model;

/**
 * Latitude/longitude pair recorded by the capture device.
 */
public record GeoPoint(double latitude, double longitude) {
}
