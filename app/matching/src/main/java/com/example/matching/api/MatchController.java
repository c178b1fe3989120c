package com.example.matching.api;

import com.example.matching.api.response.MatchesResponse;
import com.example.matching.service.MatchQueryService;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class MatchController {

  private final MatchQueryService matchQueryService;

  @GetMapping("/matches")
  public MatchesResponse list(@RequestHeader(UserIdHeader.NAME) UUID userId) {
    return matchQueryService.listMatches(userId);
  }
}
