package com.example.matching.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.matching.api.NoActiveMatchException;
import com.example.matching.api.NotAMatchMemberException;
import com.example.matching.model.MatchRecord;
import com.example.matching.repository.MatchRepository;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatAuthorizationGateTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final UUID ALICE = UUID.fromString("00000000-0000-0000-0000-00000000000a");
  private static final UUID BOB = UUID.fromString("00000000-0000-0000-0000-00000000000b");
  private static final UUID CAROL = UUID.fromString("00000000-0000-0000-0000-00000000000c");
  private static final UUID MATCH_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");

  @Mock private MatchRepository matchRepository;

  @InjectMocks private ChatAuthorizationGate gate;

  @Test
  void authorizeReflectsMatchExistence() {
    when(matchRepository.exists(ALICE, BOB)).thenReturn(true);
    when(matchRepository.exists(ALICE, CAROL)).thenReturn(false);

    assertThat(gate.authorize(ALICE, BOB)).isTrue();
    assertThat(gate.authorize(ALICE, CAROL)).isFalse();
  }

  @Test
  void requireActiveMatchRejectsUnmatchedPair() {
    when(matchRepository.exists(CAROL, ALICE)).thenReturn(false);

    assertThatThrownBy(() -> gate.requireActiveMatch(CAROL, ALICE, MATCH_ID))
        .isInstanceOf(NoActiveMatchException.class)
        .hasMessage("no active match found between users");
    verify(matchRepository, never()).findById(any());
  }

  @Test
  void requireActiveMatchRejectsMatchIdOfAnotherPair() {
    final UUID otherMatchId = UUID.fromString("22222222-2222-2222-2222-222222222222");
    when(matchRepository.exists(ALICE, BOB)).thenReturn(true);
    when(matchRepository.findById(otherMatchId))
        .thenReturn(Optional.of(new MatchRecord(otherMatchId, ALICE, CAROL, NOW, NOW)));

    assertThatThrownBy(() -> gate.requireActiveMatch(ALICE, BOB, otherMatchId))
        .isInstanceOf(NoActiveMatchException.class);
  }

  @Test
  void requireActiveMatchReturnsMatchForEitherDirection() {
    when(matchRepository.exists(BOB, ALICE)).thenReturn(true);
    when(matchRepository.findById(MATCH_ID)).thenReturn(Optional.of(match()));

    assertThat(gate.requireActiveMatch(BOB, ALICE, MATCH_ID).matchId()).isEqualTo(MATCH_ID);
  }

  @Test
  void requireMembershipTreatsUnknownMatchAsNonMember() {
    when(matchRepository.findById(MATCH_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> gate.requireMembership(ALICE, MATCH_ID))
        .isInstanceOf(NotAMatchMemberException.class);
  }

  @Test
  void requireMembershipRejectsThirdParty() {
    when(matchRepository.findById(MATCH_ID)).thenReturn(Optional.of(match()));

    assertThatThrownBy(() -> gate.requireMembership(CAROL, MATCH_ID))
        .isInstanceOf(NotAMatchMemberException.class)
        .hasMessage("not authorized to view messages for this match");
    assertThat(gate.requireMembership(BOB, MATCH_ID).matchId()).isEqualTo(MATCH_ID);
  }

  private MatchRecord match() {
    return new MatchRecord(MATCH_ID, ALICE, BOB, NOW, NOW);
  }
}
