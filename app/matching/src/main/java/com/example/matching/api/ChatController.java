/*
 * どこで: Chat API
 * 何を: メッセージ送信と履歴参照のエンドポイントを提供する
 * なぜ: マッチ済みユーザー間のチャットを公開するため
 */
package com.example.matching.api;

import com.example.matching.api.request.SendMessageRequest;
import com.example.matching.api.response.MessageResponse;
import com.example.matching.api.response.MessagesResponse;
import com.example.matching.service.ChatService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class ChatController {

  private final ChatService chatService;

  @PostMapping("/messages")
  public ResponseEntity<MessageResponse> send(
      @RequestHeader(UserIdHeader.NAME) UUID userId,
      @Valid @RequestBody SendMessageRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(chatService.send(userId, request));
  }

  @GetMapping("/matches/{match_id}/messages")
  public MessagesResponse list(
      @RequestHeader(UserIdHeader.NAME) UUID userId, @PathVariable("match_id") UUID matchId) {
    return chatService.listMessages(userId, matchId);
  }
}
