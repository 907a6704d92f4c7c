package com.dataprep.standardizer;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

@SpringBootTest
@TestPropertySource(properties = {"spring.profiles.active=test", "server.port=0"})
public class StandardizerApplicationTest {

  @Test
  public void contextLoads() {
    // Test that the Spring context loads successfully
  }
}
