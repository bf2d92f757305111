package io.chatvault.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

final class PasswordHasherTest {
    private static final PasswordHasher.Params FAST = new PasswordHasher.Params(1024, 8, 1, 32);

    @Test
    void verifiesOnlyTheOriginalPassword() {
        PasswordHasher hasher = new PasswordHasher(FAST);
        PasswordHasher.PasswordHash stored = hasher.hash("correct horse");

        Assertions.assertTrue(hasher.verify("correct horse", stored));
        Assertions.assertFalse(hasher.verify("correct horse!", stored));
        Assertions.assertFalse(hasher.verify(null, stored));
    }

    @Test
    void saltsDifferPerHash() {
        PasswordHasher hasher = new PasswordHasher(FAST);

        PasswordHasher.PasswordHash first = hasher.hash("pw");
        PasswordHasher.PasswordHash second = hasher.hash("pw");

        Assertions.assertEquals(16, first.salt().length);
        Assertions.assertFalse(Arrays.equals(first.hash(), second.hash()));
    }

    @Test
    void storedParametersAreUsedForVerification() {
        PasswordHasher.PasswordHash stored = new PasswordHasher(FAST).hash("pw");
        PasswordHasher.Params decoded = PasswordHasher.Params.decode(stored.params().encode());

        Assertions.assertEquals(FAST, decoded);
        Assertions.assertTrue(new PasswordHasher().verify("pw",
                new PasswordHasher.PasswordHash(stored.salt(), stored.hash(), decoded)));
    }

    @Test
    void defaultParametersMatchTheDocumentedCost() {
        Assertions.assertEquals("scrypt:16384:8:1:32", PasswordHasher.DEFAULT_PARAMS.encode());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new PasswordHasher.Params(1000, 8, 1, 32));
    }
}
