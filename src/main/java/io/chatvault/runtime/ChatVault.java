package io.chatvault.runtime;

import io.chatvault.config.ChatVaultConfig;
import io.chatvault.config.EnvironmentOverrides;
import io.chatvault.config.SettingsCache;
import io.chatvault.model.AuthenticatedUser;
import io.chatvault.model.ConversationView;
import io.chatvault.model.CreateUserResult;
import io.chatvault.model.DeleteUserOutcome;
import io.chatvault.model.FileRecord;
import io.chatvault.model.MemoryScope;
import io.chatvault.model.MemoryView;
import io.chatvault.model.MessageView;
import io.chatvault.model.NewConversationResult;
import io.chatvault.model.NewMemory;
import io.chatvault.model.NewMessageResult;
import io.chatvault.model.NewUser;
import io.chatvault.model.Role;
import io.chatvault.model.RoleChangeOutcome;
import io.chatvault.model.SenderType;
import io.chatvault.model.SignupDecision;
import io.chatvault.model.SignupStatus;
import io.chatvault.model.SignupSubmission;
import io.chatvault.model.SignupView;
import io.chatvault.model.Tier;
import io.chatvault.model.UserView;
import io.chatvault.security.FieldCodec;
import io.chatvault.security.KeyKind;
import io.chatvault.security.KeyManager;
import io.chatvault.security.PasswordHasher;
import io.chatvault.security.SecretStore;
import io.chatvault.storage.AccountStore;
import io.chatvault.storage.AuditLog;
import io.chatvault.storage.ContentAddressableStore;
import io.chatvault.storage.ConversationStore;
import io.chatvault.storage.EngineCapability;
import io.chatvault.storage.MemoryStore;
import io.chatvault.storage.ModeBootstrapper;
import io.chatvault.storage.SchemaManager;
import io.chatvault.storage.StoreConnection;
import io.chatvault.storage.TierSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One open ChatVault database. Owns the verified connection, the resolved keys and the
 * stores built on them; every operation runs under this object's lock.
 */
public final class ChatVault implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ChatVault.class);

    private final ChatVaultConfig config;
    private final EngineCapability capability;
    private final KeyManager keyManager;
    private final SettingsCache settings;
    private final StoreConnection connection;
    private final AccountStore accounts;
    private final ConversationStore conversations;
    private final MemoryStore memories;
    private final ContentAddressableStore cas;
    private boolean closed;

    private ChatVault(
            ChatVaultConfig config,
            EngineCapability capability,
            KeyManager keyManager,
            SettingsCache settings,
            StoreConnection connection
    ) {
        this.config = config;
        this.capability = capability;
        this.keyManager = keyManager;
        this.settings = settings;
        this.connection = connection;
        FieldCodec codec = connection.tier().fieldsSealed() ? new FieldCodec(keyManager.require(KeyKind.FIELD)) : null;
        this.accounts = new AccountStore(connection.connection(), new PasswordHasher());
        this.conversations = new ConversationStore(connection.connection(), connection.tier(), codec);
        this.memories = new MemoryStore(connection.connection(), connection.tier(), codec);
        this.cas = new ContentAddressableStore(connection.connection(), config.casDir(), config.casTmpDir());
    }

    /**
     * Bootstraps the data root and opens its database. The tier of a new database comes
     * from {@code tierOverride}, then {@code CHATVAULT_DB_MODE}, then {@code prompt}.
     */
    public static ChatVault open(
            ChatVaultConfig config,
            EnvironmentOverrides env,
            Optional<Tier> tierOverride,
            TierSelector prompt,
            Optional<? extends SecretStore> secretStore
    ) {
        return open(config, env, tierOverride, prompt, secretStore, EngineCapability.detect());
    }

    public static ChatVault open(
            ChatVaultConfig config,
            EnvironmentOverrides env,
            Optional<Tier> tierOverride,
            TierSelector prompt,
            Optional<? extends SecretStore> secretStore,
            EngineCapability capability
    ) {
        KeyManager keyManager = new KeyManager(secretStore, env);
        SettingsCache settings = new SettingsCache(config.settingsFile());
        ModeBootstrapper bootstrapper = new ModeBootstrapper(
                config,
                capability,
                keyManager,
                TierSelector.resolve(tierOverride, env, prompt),
                settings
        );
        StoreConnection connection = bootstrapper.bootstrap();
        try {
            ChatVault vault = new ChatVault(config, capability, keyManager, settings, connection);
            LOG.info("ChatVault ready: mode={}, root={}", connection.tier(), config.rootDir());
            return vault;
        } catch (RuntimeException e) {
            connection.close();
            throw e;
        }
    }

    public Tier tier() {
        return connection.tier();
    }

    public ChatVaultConfig config() {
        return config;
    }

    public synchronized Status status() {
        ensureOpen();
        String schemaVersion;
        try {
            schemaVersion = SchemaManager.readMeta(connection.connection(), "schema_version").orElse("");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read schema version", e);
        }
        return new Status(
                connection.tier(),
                connection.file(),
                schemaVersion,
                capability,
                accounts.countAdmins(),
                keyManager.hasSecretStore(),
                settings.signupRequiresApproval()
        );
    }

    // Accounts

    public synchronized CreateUserResult createUser(NewUser user, Long actorUserId) {
        ensureOpen();
        CreateUserResult result = accounts.createUser(user, actorUserId);
        if (result.created() && user.role() == Role.ADMIN) {
            refreshAdminPresence();
        }
        return result;
    }

    /**
     * Creates the first admin when none exists; returns empty when an admin is already
     * present.
     */
    public synchronized Optional<CreateUserResult> ensureAdmin(String username, String password) {
        ensureOpen();
        if (accounts.hasAdmin()) {
            return Optional.empty();
        }
        return Optional.of(createUser(NewUser.admin(username, password), null));
    }

    public synchronized Optional<AuthenticatedUser> authenticate(String username, String password) {
        ensureOpen();
        return accounts.authenticate(username, password);
    }

    /** Queues the signup for approval or creates the account, per the settings policy. */
    public synchronized SignupSubmission signUp(NewUser user) {
        ensureOpen();
        if (settings.signupRequiresApproval()) {
            return accounts.submitSignup(user);
        }
        NewUser plainUser = new NewUser(user.name(), user.handle(), user.email(), user.username(), user.password(),
                Role.USER);
        CreateUserResult created = accounts.createUser(plainUser, null);
        return switch (created.outcome()) {
            case CREATED -> SignupSubmission.created(created.userId());
            case DUPLICATE_HANDLE -> SignupSubmission.refused(SignupSubmission.Outcome.HANDLE_TAKEN);
            case DUPLICATE_EMAIL -> SignupSubmission.refused(SignupSubmission.Outcome.EMAIL_TAKEN);
            case DUPLICATE_USERNAME -> SignupSubmission.refused(SignupSubmission.Outcome.USERNAME_TAKEN);
        };
    }

    public synchronized SignupSubmission submitSignup(NewUser user) {
        ensureOpen();
        return accounts.submitSignup(user);
    }

    public synchronized List<SignupView> listSignups(Optional<SignupStatus> status, int limit) {
        ensureOpen();
        return accounts.listSignups(status, limit);
    }

    public synchronized SignupDecision approveSignup(long requestId, long adminUserId) {
        ensureOpen();
        return accounts.approveSignup(requestId, adminUserId);
    }

    public synchronized SignupDecision rejectSignup(long requestId, long adminUserId, String note) {
        ensureOpen();
        return accounts.rejectSignup(requestId, adminUserId, note);
    }

    public synchronized DeleteUserOutcome deleteUser(long userId, Long actorUserId) {
        ensureOpen();
        DeleteUserOutcome outcome = accounts.deleteUser(userId, actorUserId);
        if (outcome == DeleteUserOutcome.DELETED) {
            refreshAdminPresence();
        }
        return outcome;
    }

    public synchronized RoleChangeOutcome setRole(long userId, Role role, Long actorUserId) {
        ensureOpen();
        RoleChangeOutcome outcome = accounts.setRole(userId, role, actorUserId);
        if (outcome == RoleChangeOutcome.CHANGED) {
            refreshAdminPresence();
        }
        return outcome;
    }

    public synchronized Optional<UserView> findUser(long userId) {
        ensureOpen();
        return accounts.findUser(userId);
    }

    public synchronized boolean hasAdmin() {
        ensureOpen();
        return accounts.hasAdmin();
    }

    // Conversations and messages

    public synchronized NewConversationResult createConversation(long userId, String title) {
        ensureOpen();
        return conversations.createConversation(userId, title);
    }

    public synchronized boolean renameConversation(long conversationId, String title) {
        ensureOpen();
        return conversations.renameConversation(conversationId, title);
    }

    public synchronized boolean deleteConversation(long conversationId, Long actorUserId) {
        ensureOpen();
        return conversations.deleteConversation(conversationId, actorUserId);
    }

    public synchronized List<ConversationView> listConversations(long userId, int limit) {
        ensureOpen();
        return conversations.listConversations(userId, limit);
    }

    public synchronized NewMessageResult addMessage(
            long conversationId,
            SenderType senderType,
            Long senderId,
            String content,
            Map<String, Object> metadata
    ) {
        ensureOpen();
        return conversations.addMessage(conversationId, senderType, senderId, content, metadata);
    }

    public synchronized List<MessageView> listMessages(long conversationId, int limit) {
        ensureOpen();
        return conversations.listMessages(conversationId, limit);
    }

    // Persistent memory

    public synchronized long addMemory(NewMemory memory) {
        ensureOpen();
        return memories.addMemory(memory);
    }

    public synchronized List<MemoryView> listMemories(
            Optional<MemoryScope> scope,
            Long userId,
            Long conversationId,
            int limit
    ) {
        ensureOpen();
        return memories.listMemories(scope, userId, conversationId, limit);
    }

    public synchronized boolean reinforceMemory(long memoryId) {
        ensureOpen();
        return memories.reinforceMemory(memoryId);
    }

    public synchronized boolean deleteMemory(long memoryId) {
        ensureOpen();
        return memories.deleteMemory(memoryId);
    }

    public synchronized int purgeExpiredMemories() {
        ensureOpen();
        return memories.purgeExpired(System.currentTimeMillis());
    }

    // Attachments

    public synchronized long casPut(String sha256Hex, String mime, Path source) {
        ensureOpen();
        return cas.put(sha256Hex, mime, source);
    }

    public synchronized long casPutFile(Path source, String mime) {
        ensureOpen();
        return cas.putFile(source, mime);
    }

    public synchronized Optional<Path> casPathFor(long fileId) {
        ensureOpen();
        return cas.pathFor(fileId);
    }

    public synchronized Optional<FileRecord> casFind(long fileId) {
        ensureOpen();
        return cas.find(fileId);
    }

    public synchronized boolean casVerify(long fileId) {
        ensureOpen();
        return cas.verify(fileId);
    }

    public synchronized boolean casRelease(long fileId) {
        ensureOpen();
        return cas.release(fileId);
    }

    public synchronized boolean casSetThumbnail(long fileId, String thumbSha256Hex) {
        ensureOpen();
        return cas.setThumbnail(fileId, thumbSha256Hex);
    }

    // Audit

    public synchronized AuditLog.ChainVerification verifyAuditChain() {
        ensureOpen();
        return AuditLog.verify(connection.connection());
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        connection.close();
    }

    private void refreshAdminPresence() {
        try {
            settings.recordAdminPresence(accounts.hasAdmin());
        } catch (RuntimeException e) {
            LOG.warn("Settings cache {} could not record admin presence", settings.file(), e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("ChatVault is closed");
        }
    }

    public record Status(
            Tier tier,
            Path dbFile,
            String schemaVersion,
            EngineCapability engine,
            int adminCount,
            boolean secretStoreAvailable,
            boolean signupRequiresApproval
    ) {
    }
}
