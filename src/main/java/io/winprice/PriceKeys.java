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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.InputStream;

import javax.security.auth.Destroyable;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;

import io.winprice.KeyDecodeException.KeyType;

/**
 * The pair of keys an exchange issues to a bidder for price encryption: an integrity key, which authenticates the
 * price, and an encryption key, which masks it. Both are used as HMAC-SHA1 keys.
 * <p>
 * Key material passed in is copied, so the caller's arrays are never retained or modified. Call {@link #destroy()}
 * to wipe the copies once the keys are no longer needed.
 */
public final class PriceKeys implements Destroyable {
    static final String ENCODING_FIELD = "encoding";
    static final String INTEGRITY_KEY_FIELD = "integrity_key";
    static final String ENCRYPTION_KEY_FIELD = "encryption_key";
    static final Base64Variant DEFAULT_KEY_ENCODING = Base64Variant.URL_SAFE;

    private final DestroyableSecretKey integrityKey;
    private final DestroyableSecretKey encryptionKey;

    private PriceKeys(DestroyableSecretKey integrityKey, DestroyableSecretKey encryptionKey) {
        this.integrityKey = integrityKey;
        this.encryptionKey = encryptionKey;
    }

    /**
     * Wraps raw, already decoded, key material.
     *
     * @param integrityKey the integrity key bytes.
     * @param encryptionKey the encryption key bytes.
     * @return the keys.
     */
    public static PriceKeys of(byte[] integrityKey, byte[] encryptionKey) {
        return new PriceKeys(Crypto.hmacKey(requireNonNull(integrityKey, "integrityKey")),
                Crypto.hmacKey(requireNonNull(encryptionKey, "encryptionKey")));
    }

    /**
     * Decodes a pair of base64-encoded keys. The integrity key is decoded first.
     *
     * @param variant the base64 alphabet and padding convention both keys are encoded with.
     * @param integrityKey the encoded integrity key.
     * @param encryptionKey the encoded encryption key.
     * @return the decoded keys.
     * @throws KeyDecodeException if either key is not valid base64 for the given variant. The exception identifies
     * which of the two keys was malformed.
     */
    public static PriceKeys parse(Base64Variant variant, String integrityKey, String encryptionKey)
            throws KeyDecodeException {
        requireNonNull(variant, "variant");
        requireNonNull(integrityKey, "integrityKey");
        requireNonNull(encryptionKey, "encryptionKey");

        var icKey = decodeKey(variant, KeyType.INTEGRITY, integrityKey);
        byte[] ecKey;
        try {
            ecKey = decodeKey(variant, KeyType.ENCRYPTION, encryptionKey);
        } catch (KeyDecodeException e) {
            Utils.wipe(icKey);
            throw e;
        }

        try {
            return of(icKey, ecKey);
        } finally {
            Utils.wipe(icKey, ecKey);
        }
    }

    /**
     * Decodes a pair of base64-encoded keys supplied as ASCII bytes.
     *
     * @see #parse(Base64Variant, String, String)
     */
    public static PriceKeys parse(Base64Variant variant, byte[] integrityKey, byte[] encryptionKey)
            throws KeyDecodeException {
        return parse(variant, new String(requireNonNull(integrityKey, "integrityKey"), US_ASCII),
                new String(requireNonNull(encryptionKey, "encryptionKey"), US_ASCII));
    }

    /**
     * Reads keys from a JSON key file of the form
     * <pre>{@code
     * {
     *     "encoding": "url",
     *     "integrity_key": "arO23ykdNqUQ5LEoQ0FVmPkBd7xB5CO89PDZlSjpFxo=",
     *     "encryption_key": "skU7Ax_NL5pPAFyKdkfZjZz2-VhIN8bjj1rVFOaJ_5o="
     * }
     * }</pre>
     * The {@code encoding} field names a {@link Base64Variant} and defaults to {@code url}.
     *
     * @param json the JSON document.
     * @return the decoded keys.
     * @throws IOException if the document is not valid JSON, a key is missing or the encoding is unknown.
     * @throws KeyDecodeException if a key is not valid base64.
     */
    public static PriceKeys fromJson(String json) throws IOException, KeyDecodeException {
        requireNonNull(json, "json");
        try {
            return fromJson(JsonParser.object().from(json));
        } catch (JsonParserException e) {
            throw new IOException("Unable to parse price key file", e);
        }
    }

    /**
     * Reads keys from a JSON key file.
     *
     * @see #fromJson(String)
     */
    public static PriceKeys readFrom(InputStream in) throws IOException, KeyDecodeException {
        requireNonNull(in, "in");
        try {
            return fromJson(JsonParser.object().from(in));
        } catch (JsonParserException e) {
            throw new IOException("Unable to parse price key file", e);
        }
    }

    private static PriceKeys fromJson(JsonObject json) throws IOException, KeyDecodeException {
        var encodingName = json.containsKey(ENCODING_FIELD)
                ? requiredString(json, ENCODING_FIELD)
                : DEFAULT_KEY_ENCODING.getIdentifier();
        var variant = Base64Variant.fromIdentifier(encodingName)
                .orElseThrow(() -> new IOException("Unknown key encoding: " + encodingName));
        return parse(variant, requiredString(json, INTEGRITY_KEY_FIELD), requiredString(json, ENCRYPTION_KEY_FIELD));
    }

    private static String requiredString(JsonObject json, String field) throws IOException {
        var value = json.getString(field);
        if (value == null) {
            throw new IOException("Missing or non-string field in price key file: " + field);
        }
        return value;
    }

    private static byte[] decodeKey(Base64Variant variant, KeyType keyType, String encoded)
            throws KeyDecodeException {
        try {
            return variant.decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new KeyDecodeException(keyType, variant, e);
        }
    }

    public DestroyableSecretKey getIntegrityKey() {
        return integrityKey;
    }

    public DestroyableSecretKey getEncryptionKey() {
        return encryptionKey;
    }

    @Override
    public void destroy() {
        integrityKey.destroy();
        encryptionKey.destroy();
    }

    @Override
    public boolean isDestroyed() {
        return integrityKey.isDestroyed() && encryptionKey.isDestroyed();
    }

    @Override
    public String toString() {
        return "PriceKeys{" +
                "integrityKey=" + integrityKey +
                ", encryptionKey=" + encryptionKey +
                '}';
    }
}
