package tech.yump.credstore;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.credstore.config.CredStoreProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(CredStoreProperties.class)
public class CredStoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(CredStoreApplication.class, args);
    log.info(">>> CredStore Application Started <<<");
  }
}
