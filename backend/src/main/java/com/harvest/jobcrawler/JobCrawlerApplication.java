package com.harvest.jobcrawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobCrawlerApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobCrawlerApplication.class, args);
  }
}
