package com.example.alarm.dispatch;

import com.example.alarm.model.NotificationChannel;
import java.util.UUID;

public record PushMessage(
    NotificationChannel channel, String address, UUID incidentId, String text) {}
