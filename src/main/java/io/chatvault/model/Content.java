package io.chatvault.model;

/**
 * Stored form of a text field. The physical schema keeps a nullable plaintext column
 * next to the sealed triple; rows are mapped to exactly one of these two shapes.
 */
public interface Content {

    record Plain(String text) implements Content {
        public Plain {
            text = text == null ? "" : text;
        }
    }

    record Sealed(byte[] ciphertext, byte[] nonce, int keyId) implements Content {
        public Sealed {
            if (ciphertext == null || nonce == null) {
                throw new IllegalArgumentException("sealed content requires ciphertext and nonce");
            }
        }
    }
}
