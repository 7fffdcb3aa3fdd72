/*
 * Where: Alarm pipeline domain model
 * What: WGS84 coordinate of a sensor or recipient
 * Why: Radius queries and placement records share one validated type
 */
package com.example.alarm.model;

public record GeoPoint(double latitude, double longitude) {

  public GeoPoint {
    if (Double.isNaN(latitude) || latitude < -90.0d || latitude > 90.0d) {
      throw new IllegalArgumentException("latitude out of range: " + latitude);
    }
    if (Double.isNaN(longitude) || longitude < -180.0d || longitude > 180.0d) {
      throw new IllegalArgumentException("longitude out of range: " + longitude);
    }
  }
}
