package com.example.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessagesResponse(UUID matchId, List<MessageResponse> messages) {
  public MessagesResponse {
    messages =
        messages == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(messages));
  }
}
