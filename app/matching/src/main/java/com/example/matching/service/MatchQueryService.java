package com.example.matching.service;

import com.example.matching.api.response.ApiResponses;
import com.example.matching.api.response.MatchSummaryResponse;
import com.example.matching.api.response.MatchesResponse;
import com.example.matching.model.MatchRecord;
import com.example.matching.model.UserRecord;
import com.example.matching.repository.MatchRepository;
import com.example.matching.repository.UserRepository;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** ユーザーのマッチ一覧を相手プロフィール付きで返す。 */
@Service
@RequiredArgsConstructor
public class MatchQueryService {

  private final MatchRepository matchRepository;
  private final UserRepository userRepository;

  public MatchesResponse listMatches(UUID userId) {
    final List<MatchRecord> matches = matchRepository.findByUserId(userId);
    // 相手プロフィールは 1 クエリでまとめて引く
    final List<UUID> counterpartIds =
        matches.stream().map(match -> match.pair().counterpartOf(userId)).distinct().toList();
    final Map<UUID, UserRecord> profiles =
        userRepository.findByUserIds(counterpartIds).stream()
            .collect(Collectors.toMap(UserRecord::userId, Function.identity()));

    final List<MatchSummaryResponse> summaries =
        matches.stream()
            .map(
                match -> {
                  final UUID counterpartId = match.pair().counterpartOf(userId);
                  return new MatchSummaryResponse(
                      match.matchId(),
                      counterpartId,
                      ApiResponses.toUser(profiles.get(counterpartId)),
                      match.createdAt());
                })
            .toList();
    return new MatchesResponse(userId, summaries);
  }
}
