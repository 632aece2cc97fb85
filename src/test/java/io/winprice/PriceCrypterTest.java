/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.winprice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.IntStream;

import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import io.winprice.PriceException.Reason;

public class PriceCrypterTest {
    static final String INTEGRITY_KEY = "arO23ykdNqUQ5LEoQ0FVmPkBd7xB5CO89PDZlSjpFxo=";
    static final String ENCRYPTION_KEY = "skU7Ax_NL5pPAFyKdkfZjZz2-VhIN8bjj1rVFOaJ_5o=";
    static final byte[] SEQUENTIAL_IV = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15};

    private PriceKeys keys;
    private byte[] icKey;
    private byte[] ecKey;

    @BeforeClass
    public void loadKeys() throws Exception {
        keys = PriceKeys.parse(Base64Variant.URL_SAFE, INTEGRITY_KEY, ENCRYPTION_KEY);
        icKey = keys.getIntegrityKey().getEncoded();
        ecKey = keys.getEncryptionKey().getEncoded();
    }

    @Test
    public void shouldEncryptKnownPrice() throws Exception {
        assertThat(PriceCrypter.encryptPrice(keys, SEQUENTIAL_IV, 1900L))
                .isEqualTo("AAECAwQFBgcICQoLDA0OD-zub_WgSbwjWbtNbQ");
    }

    @Test
    public void shouldEncryptZeroPrice() throws Exception {
        assertThat(PriceCrypter.encryptPrice(icKey, ecKey, SEQUENTIAL_IV, 0L))
                .isEqualTo("AAECAwQFBgcICQoLDA0OD-zub_WgSbtPP9GXag");
    }

    @Test
    public void shouldDecryptKnownPrices() throws Exception {
        assertThat(PriceCrypter.decryptPrice(keys, "AAECAwQFBgcICQoLDA0OD-zub_WgSbwjWbtNbQ")).isEqualTo(1900L);
        assertThat(PriceCrypter.decryptPrice(icKey, ecKey, "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOgA"))
                .isEqualTo(1900L);
        assertThat(PriceCrypter.decryptPrice(keys, "AAECAwQFBgcICQoLDA0OD-zub_WgSbtPP9GXag")).isZero();
    }

    @DataProvider
    public Iterator<Object[]> prices() {
        var random = ThreadLocalRandom.current();
        return IntStream.range(0, 50)
                .mapToObj(i -> new Object[] { random.nextLong() })
                .iterator();
    }

    @DataProvider
    public Object[][] edgePrices() {
        return new Object[][] {
                { 0L }, { 1L }, { 1900L }, { Long.MAX_VALUE }, { Long.MIN_VALUE }, { -1L }
        };
    }

    @Test(dataProvider = "prices")
    public void shouldRoundTripRandomPrices(long price) throws Exception {
        var iv = Crypto.randomBytes(16);
        var encoded = PriceCrypter.encryptPrice(keys, iv, price);
        assertThat(encoded).hasSize(PriceCrypter.ENCODED_PRICE_SIZE_CHARS);
        assertThat(PriceCrypter.decryptPrice(keys, encoded)).isEqualTo(price);
    }

    @Test(dataProvider = "edgePrices")
    public void shouldRoundTripEdgePrices(long price) throws Exception {
        var encoded = PriceCrypter.encryptPrice(icKey, ecKey, SEQUENTIAL_IV, price);
        assertThat(PriceCrypter.decryptPrice(icKey, ecKey, encoded)).isEqualTo(price);
    }

    @Test
    public void shouldTreatPricesAsUnsigned() throws Exception {
        var encoded = PriceCrypter.encryptPrice(keys, SEQUENTIAL_IV, -1L);
        var decrypted = PriceCrypter.decryptPrice(keys, encoded);
        assertThat(Long.toUnsignedString(decrypted)).isEqualTo("18446744073709551615");
    }

    @Test
    public void shouldBeDeterministicForFixedIv() throws Exception {
        var first = PriceCrypter.encryptPrice(keys, SEQUENTIAL_IV, 123456789L);
        var second = PriceCrypter.encryptPrice(keys, SEQUENTIAL_IV.clone(), 123456789L);
        assertThat(first).isEqualTo(second);
    }

    @Test
    public void shouldUseFreshIvWhenNoneGiven() throws Exception {
        var encodings = new HashSet<String>();
        for (int i = 0; i < 20; ++i) {
            var encoded = PriceCrypter.encryptPrice(keys, 42L);
            assertThat(PriceCrypter.decryptPrice(keys, encoded)).isEqualTo(42L);
            encodings.add(encoded);
        }
        assertThat(encodings).hasSize(20);
    }

    @DataProvider
    public Iterator<Object[]> bitPositions() {
        return IntStream.range(0, WireBuffer.SIZE_BYTES * 8)
                .mapToObj(i -> new Object[] { i })
                .iterator();
    }

    @Test(dataProvider = "bitPositions")
    public void shouldRejectAnySingleBitFlip(int bit) throws Exception {
        var data = Base64Variant.URL_SAFE_UNPADDED.decode("YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOgA");
        data[bit / 8] ^= (byte) (1 << (bit % 8));
        var tampered = Base64Variant.URL_SAFE_UNPADDED.encode(data);

        var e = catchThrowableOfType(() -> PriceCrypter.decryptPrice(keys, tampered), PriceException.class);
        assertThat(e).isNotNull();
        assertThat(e.getReason()).isEqualTo(Reason.INTEGRITY_FAILURE);
    }

    @DataProvider
    public Iterator<Object[]> characterBitPositions() {
        return IntStream.range(0, PriceCrypter.ENCODED_PRICE_SIZE_CHARS * 8)
                .mapToObj(i -> new Object[] { i / 8, i % 8 })
                .iterator();
    }

    @Test(dataProvider = "characterBitPositions")
    public void shouldRejectAnySingleBitFlipInEncodedString(int position, int bit) {
        var chars = "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOgA".toCharArray();
        chars[position] ^= (char) (1 << bit);
        var tampered = new String(chars);

        assertThatThrownBy(() -> PriceCrypter.decryptPrice(keys, tampered)).isInstanceOf(PriceException.class);
    }

    @DataProvider
    public Object[][] nonCanonicalEndings() {
        return new Object[][] {
                { "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOgB" },
                { "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOgC" },
                { "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOgE" },
                { "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOgI" },
                { "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOgP" }
        };
    }

    @Test(dataProvider = "nonCanonicalEndings")
    public void shouldRejectUnusedTrailingBits(String encoded) {
        var e = catchThrowableOfType(() -> PriceCrypter.decryptPrice(keys, encoded), PriceException.class);
        assertThat(e.getReason()).isEqualTo(Reason.BASE64_DECODE_FAILURE);
    }

    @Test
    public void shouldRejectInvalidSignature() {
        assertThatThrownBy(() -> PriceCrypter.decryptPrice(keys, "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOlA"))
                .isInstanceOfSatisfying(PriceException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.INTEGRITY_FAILURE))
                .hasMessage("price integrity invalid");
    }

    @Test
    public void shouldNotRevealWhetherKeyOrDataIsWrong() throws Exception {
        var otherKeys = PriceKeys.of(Crypto.randomBytes(32), ecKey);
        var wrongKey = catchThrowableOfType(
                () -> PriceCrypter.decryptPrice(otherKeys, "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOgA"),
                PriceException.class);
        var tampered = catchThrowableOfType(
                () -> PriceCrypter.decryptPrice(keys, "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOlA"),
                PriceException.class);

        assertThat(wrongKey.getReason()).isEqualTo(tampered.getReason());
        assertThat(wrongKey.getMessage()).isEqualTo(tampered.getMessage());
        assertThat(wrongKey.getCause()).isNull();
        assertThat(tampered.getCause()).isNull();
    }

    @DataProvider
    public Object[][] wrongLengths() {
        return new Object[][] {
                { "" },
                { "\u0001\u0002\u0003" },
                { "test" },
                { "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOg" },
                { "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOgAA" },
                { "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOgA==" },
                { null }
        };
    }

    @Test(dataProvider = "wrongLengths")
    public void shouldRejectWrongEncodedLengthBeforeDecoding(String encoded) {
        var e = catchThrowableOfType(() -> PriceCrypter.decryptPrice(keys, encoded), PriceException.class);
        assertThat(e.getReason()).isEqualTo(Reason.WRONG_ENCODED_LENGTH);
        assertThat(e.getCause()).isNull();
    }

    @DataProvider
    public Object[][] invalidBase64() {
        return new Object[][] {
                { "Y!YYYYYYYYYYYYYYYYYYYYYYYYYYYYYYYYYYYY" },
                { "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRx+gA" },
                { "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRx/gA" },
                { "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOg=" },
                { "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxO  " }
        };
    }

    @Test(dataProvider = "invalidBase64")
    public void shouldRejectInvalidBase64(String encoded) {
        var e = catchThrowableOfType(() -> PriceCrypter.decryptPrice(keys, encoded), PriceException.class);
        assertThat(e.getReason()).isEqualTo(Reason.BASE64_DECODE_FAILURE);
        assertThat(e).hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @DataProvider
    public Object[][] emptyKeys() {
        return new Object[][] {
                { null, new byte[] { 1, 2, 3 } },
                { new byte[] { 1, 2, 3 }, null },
                { new byte[0], new byte[] { 1, 2, 3 } },
                { new byte[] { 1, 2, 3 }, new byte[0] },
                { null, null }
        };
    }

    @Test(dataProvider = "emptyKeys")
    public void shouldRejectEmptyKeysOnEncrypt(byte[] integrityKey, byte[] encryptionKey) {
        var e = catchThrowableOfType(
                () -> PriceCrypter.encryptPrice(integrityKey, encryptionKey, SEQUENTIAL_IV, 1L),
                PriceException.class);
        assertThat(e.getReason()).isEqualTo(Reason.EMPTY_KEY);
    }

    @Test(dataProvider = "emptyKeys")
    public void shouldRejectEmptyKeysOnDecryptBeforeCheckingInput(byte[] integrityKey, byte[] encryptionKey) {
        var e = catchThrowableOfType(() -> PriceCrypter.decryptPrice(integrityKey, encryptionKey, "test"),
                PriceException.class);
        assertThat(e.getReason()).isEqualTo(Reason.EMPTY_KEY);
    }

    @Test
    public void shouldRejectEmptyKeyObjects() {
        var emptyKeys = PriceKeys.of(new byte[0], ecKey);
        var onEncrypt = catchThrowableOfType(() -> PriceCrypter.encryptPrice(emptyKeys, 1L), PriceException.class);
        var onDecrypt = catchThrowableOfType(
                () -> PriceCrypter.decryptPrice(emptyKeys, "YWJjMTIzZGVmNDU2Z2hpN7fhCuPemCAWJRxOgA"),
                PriceException.class);
        assertThat(onEncrypt.getReason()).isEqualTo(Reason.EMPTY_KEY);
        assertThat(onDecrypt.getReason()).isEqualTo(Reason.EMPTY_KEY);
    }

    @DataProvider
    public Object[][] invalidIvs() {
        return new Object[][] {
                { null }, { new byte[0] }, { new byte[] { 1, 2, 3 } }, { new byte[15] }, { new byte[17] }
        };
    }

    @Test(dataProvider = "invalidIvs")
    public void shouldRejectInvalidIvLength(byte[] iv) {
        var e = catchThrowableOfType(() -> PriceCrypter.encryptPrice(keys, iv, 1L), PriceException.class);
        assertThat(e.getReason()).isEqualTo(Reason.INVALID_IV_LENGTH);
    }

    @Test
    public void shouldNotModifyCallerKeysOrIv() throws Exception {
        var integrityKey = icKey.clone();
        var encryptionKey = ecKey.clone();
        var iv = SEQUENTIAL_IV.clone();

        var encoded = PriceCrypter.encryptPrice(integrityKey, encryptionKey, iv, 1900L);
        PriceCrypter.decryptPrice(integrityKey, encryptionKey, encoded);

        assertThat(integrityKey).isEqualTo(icKey);
        assertThat(encryptionKey).isEqualTo(ecKey);
        assertThat(iv).isEqualTo(SEQUENTIAL_IV);
    }

    @Test
    public void shouldRefuseDestroyedKeys() throws Exception {
        var destroyed = PriceKeys.parse(Base64Variant.URL_SAFE, INTEGRITY_KEY, ENCRYPTION_KEY);
        destroyed.destroy();
        assertThatIllegalStateException().isThrownBy(() -> PriceCrypter.encryptPrice(destroyed, 1L));
    }

    @Test
    public void shouldBeSafeForConcurrentUse() {
        var results = IntStream.range(0, 1000).parallel()
                .mapToLong(i -> {
                    try {
                        return PriceCrypter.decryptPrice(keys, PriceCrypter.encryptPrice(keys, i));
                    } catch (PriceException e) {
                        throw new AssertionError(e);
                    }
                })
                .toArray();
        Arrays.sort(results);
        assertThat(results).isEqualTo(IntStream.range(0, 1000).asLongStream().toArray());
    }
}
