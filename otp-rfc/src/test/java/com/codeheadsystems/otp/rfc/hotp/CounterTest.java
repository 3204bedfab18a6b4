package com.codeheadsystems.otp.rfc.hotp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CounterTest {

  @Test
  void toBytes_isEightByteBigEndian() {
    assertThat(Hex.toHexString(new Counter(0x0102030405060708L).toBytes()))
        .isEqualTo("0102030405060708");
    assertThat(Counter.ZERO.toBytes()).hasSize(8).containsOnly((byte) 0);
  }

  @Test
  void fromBytes_readsWhatToBytesWrote() {
    Counter counter = new Counter(37037036L);
    assertThat(Counter.fromBytes(counter.toBytes())).isEqualTo(counter);
  }

  @Test
  void fromBytes_wrongLengthThrows() {
    assertThatThrownBy(() -> Counter.fromBytes(new byte[7]))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("8 bytes");
  }

  @ParameterizedTest
  @ValueSource(longs = {0L, 1L, 255L, 256L, 0xFFFFFFFFL, Long.MAX_VALUE})
  void increment_isSuccessor(long value) {
    assertThat(new Counter(value).increment().value()).isEqualTo(value + 1);
  }

  @Test
  void increment_wrapsAtTwoToTheSixtyFour() {
    Counter max = new Counter(0xFFFFFFFFFFFFFFFFL);
    assertThat(max.toString()).isEqualTo("18446744073709551615");
    assertThat(max.increment()).isEqualTo(Counter.ZERO);
  }

  @Test
  void increment_carriesAcrossBytes() {
    assertThat(Hex.toHexString(new Counter(0xFFL).increment().toBytes()))
        .isEqualTo("0000000000000100");
  }

  @Test
  void increment_doesNotChangeOriginal() {
    Counter counter = new Counter(5L);
    counter.increment();
    assertThat(counter.value()).isEqualTo(5L);
  }

  @Test
  void plus_advancesBySteps() {
    assertThat(new Counter(10L).plus(5)).isEqualTo(new Counter(15L));
    assertThatThrownBy(() -> new Counter(10L).plus(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void compareTo_isUnsigned() {
    Counter high = new Counter(Long.MIN_VALUE); // 2^63 unsigned
    assertThat(high).isGreaterThan(new Counter(Long.MAX_VALUE));
    assertThat(new Counter(1L)).isLessThan(new Counter(2L));
    assertThat(new Counter(7L).compareTo(new Counter(7L))).isZero();
  }

  @Test
  void toString_isUnsignedDecimal() {
    assertThat(new Counter(Long.MIN_VALUE).toString()).isEqualTo("9223372036854775808");
  }
}
