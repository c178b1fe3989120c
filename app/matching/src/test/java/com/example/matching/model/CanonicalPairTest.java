package com.example.matching.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class CanonicalPairTest {

  private static final UUID USER_A = UUID.fromString("00000000-0000-0000-0000-00000000000a");
  private static final UUID USER_B = UUID.fromString("00000000-0000-0000-0000-00000000000b");

  @Test
  void ofIsSymmetric() {
    final CanonicalPair forward = CanonicalPair.of(USER_A, USER_B);
    final CanonicalPair backward = CanonicalPair.of(USER_B, USER_A);

    assertThat(forward).isEqualTo(backward);
    assertThat(forward.low()).isEqualTo(USER_A);
    assertThat(forward.high()).isEqualTo(USER_B);
  }

  @Test
  void ofRejectsSameUser() {
    assertThatThrownBy(() -> CanonicalPair.of(USER_A, USER_A))
        .isInstanceOf(InvalidPairException.class);
  }

  @Test
  void constructorRejectsUnorderedPair() {
    assertThatThrownBy(() -> new CanonicalPair(USER_B, USER_A))
        .isInstanceOf(InvalidPairException.class);
  }

  @Test
  void orderFollowsUnsignedByteOrderNotUuidCompareTo() {
    // 先頭ビットが立った UUID は UUID.compareTo では負数扱いで小さくなる
    final UUID highBit = UUID.fromString("80000000-0000-0000-0000-000000000000");
    final UUID lowBit = UUID.fromString("10000000-0000-0000-0000-000000000000");

    final CanonicalPair pair = CanonicalPair.of(highBit, lowBit);

    assertThat(highBit.compareTo(lowBit)).isNegative();
    assertThat(pair.low()).isEqualTo(lowBit);
    assertThat(pair.high()).isEqualTo(highBit);
  }

  @Test
  void counterpartOfReturnsOtherMember() {
    final CanonicalPair pair = CanonicalPair.of(USER_B, USER_A);

    assertThat(pair.counterpartOf(USER_A)).isEqualTo(USER_B);
    assertThat(pair.counterpartOf(USER_B)).isEqualTo(USER_A);
    assertThat(pair.contains(USER_A)).isTrue();
    assertThatThrownBy(() -> pair.counterpartOf(UUID.randomUUID()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
