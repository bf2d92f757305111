package io.chatvault.security;

/**
 * The two independent secrets. Each has a fixed secret-store account and a hex-encoded
 * environment fallback.
 */
public enum KeyKind {
    DATABASE("sqlcipher-dbkey", "CHATVAULT_KEY_DB"),
    FIELD("field-key-v1", "CHATVAULT_KEY_FIELD");

    private final String account;
    private final String envVar;

    KeyKind(String account, String envVar) {
        this.account = account;
        this.envVar = envVar;
    }

    public String account() {
        return account;
    }

    public String envVar() {
        return envVar;
    }
}
