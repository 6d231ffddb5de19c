package com.github.spud.sample.ai.finance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinanceAgentApplication {

  public static void main(String[] args) {
    SpringApplication.run(FinanceAgentApplication.class, args);
  }

}
