/*
 * Where: Alarm pipeline domain model
 * What: Registered notification recipient with its reachable addresses
 */
package com.example.alarm.model;

public record Recipient(
    String recipientId,
    String houseId,
    RecipientRole role,
    String pushToken,
    String phoneNumber,
    String email,
    GeoPoint location) {}
