package io.intellixity.tenantdb.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class TenantDbExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(TenantDbExamplesApplication.class, args);
  }
}
