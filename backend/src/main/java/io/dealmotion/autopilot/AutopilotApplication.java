package io.dealmotion.autopilot;

import io.dealmotion.autopilot.config.AutopilotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AutopilotProperties.class)
public class AutopilotApplication {

  public static void main(String[] args) {
    SpringApplication.run(AutopilotApplication.class, args);
  }
}
