/*
 * どこで: Chat サービス層
 * 何を: マッチ済みユーザー間のメッセージ送信と履歴参照を行う
 * なぜ: 認可ゲートを通過した場合のみ保存/参照するため
 */
package com.example.matching.service;

import com.example.matching.model.InvalidPairException;
import com.example.matching.api.NoActiveMatchException;
import com.example.matching.api.NotAMatchMemberException;
import com.example.matching.api.StorageUnavailableException;
import com.example.matching.api.request.SendMessageRequest;
import com.example.matching.api.response.ApiResponses;
import com.example.matching.api.response.MessageResponse;
import com.example.matching.api.response.MessagesResponse;
import com.example.matching.config.MatchingChatProperties;
import com.example.matching.model.MatchRecord;
import com.example.matching.model.MessageRecord;
import com.example.matching.repository.MessageRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ChatService {

  private static final Logger logger = LoggerFactory.getLogger(ChatService.class);

  private final ChatAuthorizationGate authorizationGate;
  private final MessageRepository messageRepository;
  private final MatchingChatProperties properties;
  private final MatchingMetrics metrics;
  private final Clock clock;

  public MessageResponse send(UUID senderId, SendMessageRequest request) {
    // サロゲートペアを 1 文字として数える
    final String content = request.content();
    if (content.codePointCount(0, content.length()) > properties.maxContentLength()) {
      metrics.recordChat("send", "too_long");
      throw new IllegalArgumentException(
          "content must be at most " + properties.maxContentLength() + " characters");
    }
    final MatchRecord match;
    try {
      match =
          authorizationGate.requireActiveMatch(senderId, request.receiverId(), request.matchId());
    } catch (StorageUnavailableException ex) {
      metrics.recordChat("send", "storage_unavailable");
      throw ex;
    } catch (NoActiveMatchException | InvalidPairException ex) {
      metrics.recordChat("send", "denied");
      logger.info(
          "chat send denied senderId={} receiverId={} matchId={}",
          senderId,
          request.receiverId(),
          request.matchId());
      throw ex;
    }

    final MessageRecord saved =
        messageRepository.insert(
            new MessageRecord(
                UUID.randomUUID(),
                match.matchId(),
                senderId,
                request.receiverId(),
                request.content(),
                Instant.now(clock)));
    metrics.recordChat("send", "sent");
    return ApiResponses.toMessage(saved);
  }

  /** 古い順に返す。 */
  public MessagesResponse listMessages(UUID requesterId, UUID matchId) {
    final MatchRecord match;
    try {
      match = authorizationGate.requireMembership(requesterId, matchId);
    } catch (StorageUnavailableException ex) {
      metrics.recordChat("read", "storage_unavailable");
      throw ex;
    } catch (NotAMatchMemberException ex) {
      metrics.recordChat("read", "denied");
      throw ex;
    }
    final List<MessageResponse> messages =
        messageRepository.findByMatchId(match.matchId()).stream()
            .map(ApiResponses::toMessage)
            .toList();
    metrics.recordChat("read", "ok");
    return new MessagesResponse(match.matchId(), messages);
  }
}
