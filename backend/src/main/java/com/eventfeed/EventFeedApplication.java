package com.eventfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EventFeedApplication {

  public static void main(String[] args) {
    SpringApplication.run(EventFeedApplication.class, args);
  }
}
