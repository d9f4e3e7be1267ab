package io.b2mash.taskflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TaskflowApplication {

  public static void main(String[] args) {
    SpringApplication.run(TaskflowApplication.class, args);
  }
}
