/*
 * どこで: Chat サービス層
 * 何を: 2 ユーザー間のメッセージ送受信がマッチで許可されているかを判定する
 * なぜ: マッチしていない相手へのチャットを常に拒否するため
 */
package com.example.matching.service;

import com.example.matching.api.NoActiveMatchException;
import com.example.matching.api.NotAMatchMemberException;
import com.example.matching.model.CanonicalPair;
import com.example.matching.model.MatchRecord;
import com.example.matching.repository.MatchRepository;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ChatAuthorizationGate {

  private final MatchRepository matchRepository;

  /** 引数の順序に依存しない。自分自身とのペアは InvalidPairException。 */
  public boolean authorize(UUID requesterId, UUID counterpartId) {
    return matchRepository.exists(requesterId, counterpartId);
  }

  /** 送信者と受信者のマッチが存在し、かつ matchId がそのマッチを指すことを要求する。 */
  public MatchRecord requireActiveMatch(UUID senderId, UUID receiverId, UUID matchId) {
    if (!authorize(senderId, receiverId)) {
      throw new NoActiveMatchException();
    }
    final CanonicalPair pair = CanonicalPair.of(senderId, receiverId);
    return matchRepository
        .findById(matchId)
        .filter(match -> match.pair().equals(pair))
        .orElseThrow(NoActiveMatchException::new);
  }

  /** 存在しない matchId も非メンバーと同じ扱いにする。 */
  public MatchRecord requireMembership(UUID requesterId, UUID matchId) {
    return matchRepository
        .findById(matchId)
        .filter(match -> match.hasMember(requesterId))
        .orElseThrow(NotAMatchMemberException::new);
  }
}
