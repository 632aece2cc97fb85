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

import static java.util.Objects.requireNonNull;

/**
 * Signals that one of the two price keys could not be decoded from its textual form.
 */
public final class KeyDecodeException extends Exception {
    private static final long serialVersionUID = 1L;

    public enum KeyType {
        INTEGRITY("integrity"),
        ENCRYPTION("encryption");

        private final String label;

        KeyType(String label) {
            this.label = label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    private final KeyType keyType;

    KeyDecodeException(KeyType keyType, Base64Variant variant, Throwable cause) {
        super("could not decode price " + keyType + " key as " + variant.getIdentifier() + " base64", cause);
        this.keyType = requireNonNull(keyType, "keyType");
    }

    /**
     * Identifies which key was malformed.
     *
     * @return the type of the key that failed to decode.
     */
    public KeyType getKeyType() {
        return keyType;
    }
}
