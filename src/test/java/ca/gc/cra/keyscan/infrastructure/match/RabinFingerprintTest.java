package ca.gc.cra.keyscan.infrastructure.match;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.keyscan.domain.scan.ByteKey;
import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import java.math.BigInteger;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RabinFingerprintTest {

  @Test
  void rollingMatchesDirectFingerprint() {
    byte[] data = new byte[512];
    new Random(9).nextBytes(data);
    DumpBuffer buffer = DumpBuffer.wrap(data);
    RabinFingerprint fingerprint = new RabinFingerprint(8);

    long hash = fingerprint.of(buffer, 0);
    for (int offset = 1; offset + 8 <= data.length; offset++) {
      hash = fingerprint.roll(hash, buffer.unsignedAt(offset - 1), buffer.unsignedAt(offset + 7));
      assertEquals(fingerprint.of(buffer, offset), hash, "offset " + offset);
    }
  }

  @Test
  void keyFingerprintCoversPrefixOnly() {
    RabinFingerprint fingerprint = new RabinFingerprint(2);
    DumpBuffer buffer = DumpBuffer.wrap(new byte[] {7, 9, 1});

    assertEquals(fingerprint.of(buffer, 0), fingerprint.of(ByteKey.of(new byte[] {7, 9, 42, 42})));
    assertThrows(IllegalArgumentException.class, () -> fingerprint.of(ByteKey.of(new byte[] {7})));
  }

  @Test
  void mulModMatchesBigIntegerArithmetic() {
    Random random = new Random(17);
    BigInteger mod = BigInteger.valueOf(RabinFingerprint.MOD);
    for (int i = 0; i < 1_000; i++) {
      long a = Math.floorMod(random.nextLong(), RabinFingerprint.MOD);
      long b = Math.floorMod(random.nextLong(), RabinFingerprint.MOD);
      long expected = BigInteger.valueOf(a).multiply(BigInteger.valueOf(b)).mod(mod).longValueExact();
      assertEquals(expected, RabinFingerprint.mulMod(a, b));
    }
    assertEquals(0, RabinFingerprint.mulMod(RabinFingerprint.MOD - 1, 0));
    assertEquals(1, RabinFingerprint.mulMod(RabinFingerprint.MOD - 1, RabinFingerprint.MOD - 1));
  }
}
