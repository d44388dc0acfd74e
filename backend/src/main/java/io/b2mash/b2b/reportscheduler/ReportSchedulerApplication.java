package io.b2mash.b2b.reportscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReportSchedulerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ReportSchedulerApplication.class, args);
  }
}
