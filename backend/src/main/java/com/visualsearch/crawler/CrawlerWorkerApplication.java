package com.visualsearch.crawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CrawlerWorkerApplication {

  public static void main(String[] args) {
    SpringApplication.run(CrawlerWorkerApplication.class, args);
  }
}
