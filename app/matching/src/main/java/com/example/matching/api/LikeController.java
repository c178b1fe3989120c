/*
 * どこで: Matching API
 * 何を: like/pass の記録エンドポイントを提供する
 * なぜ: 判定の記録とマッチ成立の通知を 1 リクエストで返すため
 */
package com.example.matching.api;

import com.example.matching.api.request.LikeRequest;
import com.example.matching.api.request.PassRequest;
import com.example.matching.api.response.ApiResponses;
import com.example.matching.api.response.LikeResponse;
import com.example.matching.api.response.PassResponse;
import com.example.matching.model.Decision;
import com.example.matching.service.DecisionResult;
import com.example.matching.service.MatchingService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class LikeController {

  private final MatchingService matchingService;

  /** status=pass もここで受け付ける。 */
  @PostMapping("/likes")
  public ResponseEntity<LikeResponse> like(
      @RequestHeader(UserIdHeader.NAME) UUID userId, @Valid @RequestBody LikeRequest request) {
    final DecisionResult result =
        matchingService.recordDecision(
            userId, request.targetUserId(), Decision.fromValue(request.status()));
    final LikeResponse body =
        new LikeResponse(
            ApiResponses.toPreference(result.preference()),
            result.matched(),
            ApiResponses.toMatch(result.match()));
    return ResponseEntity.status(HttpStatus.CREATED).body(body);
  }

  @PostMapping("/passes")
  public ResponseEntity<PassResponse> pass(
      @RequestHeader(UserIdHeader.NAME) UUID userId, @Valid @RequestBody PassRequest request) {
    final DecisionResult result =
        matchingService.recordDecision(userId, request.targetUserId(), Decision.PASS);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(new PassResponse(ApiResponses.toPreference(result.preference())));
  }
}
