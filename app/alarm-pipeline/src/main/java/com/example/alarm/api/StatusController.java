/*
 * Where: Alarm pipeline API
 * What: Plain-text liveness endpoint
 */
package com.example.alarm.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String status() {
    return "alarm-pipeline: ok";
  }
}
