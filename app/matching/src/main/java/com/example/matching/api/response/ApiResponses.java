package com.example.matching.api.response;

import com.example.matching.model.MatchRecord;
import com.example.matching.model.MessageRecord;
import com.example.matching.model.PreferenceRecord;
import com.example.matching.model.UserRecord;

/** ドメインレコードから API レスポンスへの変換。 */
public final class ApiResponses {

  private ApiResponses() {}

  public static PreferenceResponse toPreference(PreferenceRecord record) {
    return new PreferenceResponse(
        record.id(),
        record.userId(),
        record.targetUserId(),
        record.decision().value(),
        record.createdAt(),
        record.updatedAt());
  }

  public static MatchResponse toMatch(MatchRecord record) {
    if (record == null) {
      return null;
    }
    return new MatchResponse(
        record.matchId(),
        record.userLow(),
        record.userHigh(),
        record.createdAt(),
        record.updatedAt());
  }

  public static MessageResponse toMessage(MessageRecord record) {
    return new MessageResponse(
        record.id(),
        record.matchId(),
        record.senderId(),
        record.receiverId(),
        record.content(),
        record.createdAt());
  }

  public static UserResponse toUser(UserRecord record) {
    if (record == null) {
      return null;
    }
    return new UserResponse(
        record.userId(),
        record.name(),
        record.gender().value(),
        record.birthDate(),
        record.bio(),
        record.createdAt(),
        record.updatedAt());
  }
}
