/*
 * どこで: Matching サービス層
 * 何を: プロフィールの作成/参照/部分更新を行う
 * なぜ: マッチ一覧に相手の表示情報を載せるため
 */
package com.example.matching.service;

import com.example.matching.api.UserAlreadyExistsException;
import com.example.matching.api.UserNotFoundException;
import com.example.matching.api.request.UserCreateRequest;
import com.example.matching.api.request.UserPatchRequest;
import com.example.matching.api.response.ApiResponses;
import com.example.matching.api.response.UserResponse;
import com.example.matching.model.Gender;
import com.example.matching.model.UserRecord;
import com.example.matching.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UserService {

  private static final Logger logger = LoggerFactory.getLogger(UserService.class);

  private final UserRepository userRepository;
  private final Clock clock;

  public UserResponse create(UUID userId, UserCreateRequest request) {
    final Gender gender = Gender.fromValue(request.gender());
    final Instant now = Instant.now(clock);
    final UserRecord candidate =
        new UserRecord(
            userId,
            request.name().trim(),
            gender,
            request.birthDate(),
            normalizeBio(request.bio()),
            now,
            now);
    final UserRecord created =
        userRepository.insertIfAbsent(candidate).orElseThrow(UserAlreadyExistsException::new);
    logger.info("user profile created userId={}", userId);
    return ApiResponses.toUser(created);
  }

  public UserResponse get(UUID userId) {
    return userRepository
        .findByUserId(userId)
        .map(ApiResponses::toUser)
        .orElseThrow(UserNotFoundException::new);
  }

  public UserResponse patch(UUID userId, UserPatchRequest request) {
    final String name = request.name() == null ? null : request.name().trim();
    if (name != null && name.isEmpty()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    return userRepository
        .updateProfile(userId, name, normalizeBio(request.bio()), Instant.now(clock))
        .map(ApiResponses::toUser)
        .orElseThrow(UserNotFoundException::new);
  }

  private String normalizeBio(String bio) {
    return bio == null ? null : bio.strip();
  }
}
