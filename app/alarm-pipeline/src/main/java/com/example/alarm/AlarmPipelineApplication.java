/*
 * Where: Alarm pipeline entry point
 * What: Boots Spring with configuration scanning and scheduled workers
 */
package com.example.alarm;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class AlarmPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(AlarmPipelineApplication.class, args);
  }
}
