/*
 * Where: Alarm pipeline API
 * What: Standard error body returned by every endpoint
 */
package com.example.alarm.api;

public record ApiErrorResponse(String code, String message) {}
