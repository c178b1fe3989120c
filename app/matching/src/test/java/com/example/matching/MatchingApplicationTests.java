package com.example.matching;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.matching.service.MatchingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class MatchingApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private MatchingService matchingService;

  @Test
  void contextLoads() {
    assertThat(matchingService).isNotNull();
  }
}
