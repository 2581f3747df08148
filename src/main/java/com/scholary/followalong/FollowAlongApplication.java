package com.scholary.followalong;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class FollowAlongApplication {

  public static void main(String[] args) {
    SpringApplication.run(FollowAlongApplication.class, args);
  }
}
