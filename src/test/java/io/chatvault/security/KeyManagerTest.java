package io.chatvault.security;

import io.chatvault.config.EnvironmentOverrides;
import io.chatvault.util.Hashing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

final class KeyManagerTest {
    private static final String HEX_A = "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";
    private static final String HEX_B = "ffeeddccbbaa99887766554433221100ffeeddccbbaa99887766554433221100";

    @Test
    void secretStoreWinsOverEnvironment() {
        InMemorySecretStore store = new InMemorySecretStore().put(KeyKind.DATABASE.account(), HEX_A);
        KeyManager keys = new KeyManager(Optional.of(store),
                EnvironmentOverrides.from(Map.of(KeyKind.DATABASE.envVar(), HEX_B)));

        KeyMaterial key = keys.getOrCreate(KeyKind.DATABASE, true).orElseThrow();

        Assertions.assertEquals(KeyMaterial.Source.SECRET_STORE, key.source());
        Assertions.assertEquals(HEX_A, Hashing.toHex(key.bytes()));
    }

    @Test
    void environmentIsUsedWhenStoreHasNoEntry() {
        KeyManager keys = new KeyManager(Optional.of(new InMemorySecretStore()),
                EnvironmentOverrides.from(Map.of(KeyKind.FIELD.envVar(), HEX_B)));

        KeyMaterial key = keys.getOrCreate(KeyKind.FIELD, true).orElseThrow();

        Assertions.assertEquals(KeyMaterial.Source.ENVIRONMENT, key.source());
        Assertions.assertEquals(HEX_B, Hashing.toHex(key.bytes()));
    }

    @Test
    void unreadableStoreFallsThroughToEnvironment() {
        InMemorySecretStore store = new InMemorySecretStore()
                .put(KeyKind.DATABASE.account(), HEX_A)
                .failReads(true);
        KeyManager keys = new KeyManager(Optional.of(store),
                EnvironmentOverrides.from(Map.of(KeyKind.DATABASE.envVar(), HEX_B)));

        KeyMaterial key = keys.getOrCreate(KeyKind.DATABASE, true).orElseThrow();

        Assertions.assertEquals(KeyMaterial.Source.ENVIRONMENT, key.source());
        Assertions.assertEquals(HEX_B, Hashing.toHex(key.bytes()));
        Assertions.assertTrue(new KeyManager(Optional.of(store), EnvironmentOverrides.none())
                .getOrCreate(KeyKind.DATABASE, true).isEmpty());
    }

    @Test
    void existingOnlyNeverCreates() {
        InMemorySecretStore store = new InMemorySecretStore();
        KeyManager keys = new KeyManager(Optional.of(store), EnvironmentOverrides.none());

        Assertions.assertTrue(keys.getOrCreate(KeyKind.DATABASE, true).isEmpty());
        Assertions.assertEquals(0, store.writes());
        KeyUnavailableException e = Assertions.assertThrows(KeyUnavailableException.class,
                () -> keys.require(KeyKind.DATABASE));
        Assertions.assertEquals(KeyKind.DATABASE, e.kind());
    }

    @Test
    void generatedKeyIsWrittenToTheStoreAndCached() {
        InMemorySecretStore store = new InMemorySecretStore();
        KeyManager keys = new KeyManager(Optional.of(store), EnvironmentOverrides.none());

        KeyMaterial created = keys.getOrCreate(KeyKind.FIELD, false).orElseThrow();
        KeyMaterial again = keys.getOrCreate(KeyKind.FIELD, true).orElseThrow();

        Assertions.assertEquals(KeyMaterial.Source.GENERATED_STORED, created.source());
        Assertions.assertTrue(created.durable());
        Assertions.assertSame(created, again);
        Assertions.assertEquals(Hashing.toHex(created.bytes()), store.get(KeyKind.FIELD.account()).orElseThrow());
        Assertions.assertEquals(1, store.writes());
    }

    @Test
    void storeWriteFailureYieldsEphemeralKey() {
        InMemorySecretStore store = new InMemorySecretStore().failWrites(true);
        KeyManager keys = new KeyManager(Optional.of(store), EnvironmentOverrides.none());

        KeyMaterial key = keys.getOrCreate(KeyKind.DATABASE, false).orElseThrow();

        Assertions.assertEquals(KeyMaterial.Source.EPHEMERAL, key.source());
        Assertions.assertFalse(key.durable());
    }

    @Test
    void noStoreYieldsEphemeralKey() {
        KeyManager keys = new KeyManager(Optional.empty(), EnvironmentOverrides.none());

        Assertions.assertFalse(keys.hasSecretStore());
        Assertions.assertEquals(KeyMaterial.Source.EPHEMERAL,
                keys.getOrCreate(KeyKind.FIELD, false).orElseThrow().source());
    }

    @Test
    void malformedValuesAreSkipped() {
        InMemorySecretStore store = new InMemorySecretStore().put(KeyKind.DATABASE.account(), "not-hex");
        KeyManager keys = new KeyManager(Optional.of(store),
                EnvironmentOverrides.from(Map.of(KeyKind.DATABASE.envVar(), "abcd")));

        Assertions.assertTrue(keys.getOrCreate(KeyKind.DATABASE, true).isEmpty());
    }

    @Test
    void keyMaterialNeverPrintsItsBytes() {
        InMemorySecretStore store = new InMemorySecretStore().put(KeyKind.DATABASE.account(), HEX_A);
        KeyMaterial key = new KeyManager(Optional.of(store), EnvironmentOverrides.none())
                .getOrCreate(KeyKind.DATABASE, true).orElseThrow();

        Assertions.assertFalse(key.toString().contains(HEX_A));
        Assertions.assertEquals("\"x'" + HEX_A + "'\"", key.sqlCipherLiteral());
    }
}
