package com.ospicorp.anomalydetection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnomalyDetectionApplication {

  public static void main(String[] args) {
    SpringApplication.run(AnomalyDetectionApplication.class, args);
  }
}
