package io.chatvault.storage;

import io.chatvault.TestDirs;
import io.chatvault.model.MemoryScope;
import io.chatvault.model.MemoryView;
import io.chatvault.model.NewMemory;
import io.chatvault.model.Tier;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;
import java.util.Optional;

final class MemoryStoreTest {

    @Test
    void listsUnexpiredMemoriesByImportance() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-memory-list-");
        try (Connection conn = StorageFixtures.schemaDatabase(root.resolve("t.db"), Tier.OPEN)) {
            long user = ConversationStoreTest.newUser(conn);
            MemoryStore store = new MemoryStore(conn, Tier.OPEN, null);
            long now = System.currentTimeMillis();
            long low = store.addMemory(new NewMemory(MemoryScope.USER, user, null, "diet", "vegetarian", 1, null));
            long high = store.addMemory(new NewMemory(MemoryScope.USER, user, null, "name", "goes by Sam", 5, null));
            store.addMemory(new NewMemory(MemoryScope.USER, user, null, "old", "expired", 9, now - 1_000));
            store.addMemory(new NewMemory(MemoryScope.GLOBAL, null, null, null, "global note", 3, null));

            List<MemoryView> forUser = store.listMemories(Optional.of(MemoryScope.USER), user, null, 10);
            Assertions.assertEquals(List.of(high, low), forUser.stream().map(MemoryView::memoryId).toList());
            Assertions.assertEquals("goes by Sam", forUser.get(0).body().orThrow());

            Assertions.assertEquals(3, store.listMemories(Optional.empty(), null, null, 10).size());
            Assertions.assertEquals(1, store.listMemories(Optional.empty(), null, null, 1).size());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void reinforceRaisesImportance() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-memory-reinforce-");
        try (Connection conn = StorageFixtures.schemaDatabase(root.resolve("t.db"), Tier.OPEN)) {
            MemoryStore store = new MemoryStore(conn, Tier.OPEN, null);
            long a = store.addMemory(new NewMemory(MemoryScope.GLOBAL, null, null, "a", "first", 2, null));
            long b = store.addMemory(new NewMemory(MemoryScope.GLOBAL, null, null, "b", "second", 2, null));

            Assertions.assertTrue(store.reinforceMemory(a));
            Assertions.assertFalse(store.reinforceMemory(999L));

            MemoryView top = store.listMemories(Optional.empty(), null, null, 10).get(0);
            Assertions.assertEquals(a, top.memoryId());
            Assertions.assertEquals(3, top.importance());
            Assertions.assertNotNull(top.reinforcedAtMs());
            Assertions.assertTrue(store.deleteMemory(b));
            Assertions.assertFalse(store.deleteMemory(b));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void purgeRemovesOnlyExpiredRows() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-memory-purge-");
        try (Connection conn = StorageFixtures.schemaDatabase(root.resolve("t.db"), Tier.OPEN)) {
            MemoryStore store = new MemoryStore(conn, Tier.OPEN, null);
            store.addMemory(new NewMemory(MemoryScope.GLOBAL, null, null, null, "keep", 0, null));
            store.addMemory(new NewMemory(MemoryScope.GLOBAL, null, null, null, "later", 0, 2_000L));
            store.addMemory(new NewMemory(MemoryScope.GLOBAL, null, null, null, "gone", 0, 1_000L));

            Assertions.assertEquals(1, store.purgeExpired(1_000L));
            Assertions.assertEquals(2, StorageFixtures.count(conn, "SELECT COUNT(*) FROM persistent_memory"));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void strictTierSealsMemoryContent() throws Exception {
        Path root = Files.createTempDirectory("chatvault-test-memory-strict-");
        try (Connection conn = StorageFixtures.schemaDatabase(root.resolve("t.db"), Tier.STRICT)) {
            MemoryStore store = new MemoryStore(conn, Tier.STRICT, StorageFixtures.randomCodec());
            store.addMemory(new NewMemory(MemoryScope.GLOBAL, null, null, "pin", "1234", 1, null));

            Assertions.assertEquals(0, StorageFixtures.count(conn,
                    "SELECT COUNT(*) FROM persistent_memory WHERE content IS NOT NULL"));
            Assertions.assertEquals("1234",
                    store.listMemories(Optional.empty(), null, null, 10).get(0).body().orThrow());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void scopeRequiresItsOwner() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new NewMemory(MemoryScope.USER, null, null, null, "x", 0, null));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new NewMemory(MemoryScope.CONVERSATION, 1L, null, null, "x", 0, null));
    }
}
