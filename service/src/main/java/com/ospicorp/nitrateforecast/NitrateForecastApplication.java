package com.ospicorp.nitrateforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NitrateForecastApplication {

  public static void main(String[] args) {
    SpringApplication.run(NitrateForecastApplication.class, args);
  }
}
