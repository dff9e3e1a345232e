package io.b2mash.hms.hmsadmin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HmsAdminApplication {

  public static void main(String[] args) {
    SpringApplication.run(HmsAdminApplication.class, args);
  }
}
