package com.example.alarm.model;

public enum RecipientRole {
  OCCUPANT,
  EMERGENCY
}
