package com.scholary.tracklist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class TracklistApplication {

  public static void main(String[] args) {
    SpringApplication.run(TracklistApplication.class, args);
  }
}
