package io.chatvault.cli;

import io.chatvault.ChatVaultException;
import io.chatvault.config.ChatVaultConfig;
import io.chatvault.config.EnvironmentOverrides;
import io.chatvault.model.ConversationView;
import io.chatvault.model.CreateUserResult;
import io.chatvault.model.DeleteUserOutcome;
import io.chatvault.model.MessageView;
import io.chatvault.model.NewConversationResult;
import io.chatvault.model.NewMessageResult;
import io.chatvault.model.NewUser;
import io.chatvault.model.Role;
import io.chatvault.model.RoleChangeOutcome;
import io.chatvault.model.SenderType;
import io.chatvault.model.SignupDecision;
import io.chatvault.model.SignupStatus;
import io.chatvault.model.SignupSubmission;
import io.chatvault.model.Tier;
import io.chatvault.runtime.ChatVault;
import io.chatvault.security.KeyManager;
import io.chatvault.security.KeyringSecretStore;
import io.chatvault.security.SecretStore;
import io.chatvault.storage.AuditLog;
import io.chatvault.storage.TierSelector;
import io.chatvault.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

@Command(
        name = "chatvault",
        mixinStandardHelpOptions = true,
        description = "ChatVault local conversation store CLI",
        subcommands = {
                ChatVaultCommand.InitCommand.class,
                ChatVaultCommand.StatusCommand.class,
                ChatVaultCommand.UserCreateCommand.class,
                ChatVaultCommand.UserDeleteCommand.class,
                ChatVaultCommand.UserRoleCommand.class,
                ChatVaultCommand.LoginCommand.class,
                ChatVaultCommand.SignupSubmitCommand.class,
                ChatVaultCommand.SignupsCommand.class,
                ChatVaultCommand.SignupApproveCommand.class,
                ChatVaultCommand.SignupRejectCommand.class,
                ChatVaultCommand.ConversationsCommand.class,
                ChatVaultCommand.ConversationCreateCommand.class,
                ChatVaultCommand.ConversationRenameCommand.class,
                ChatVaultCommand.ConversationDeleteCommand.class,
                ChatVaultCommand.MessageAddCommand.class,
                ChatVaultCommand.MessagesCommand.class,
                ChatVaultCommand.CasPutCommand.class,
                ChatVaultCommand.CasPathCommand.class,
                ChatVaultCommand.CasReleaseCommand.class,
                ChatVaultCommand.AuditVerifyCommand.class
        }
)
public final class ChatVaultCommand implements Runnable {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_REFUSED = 2;

    private final EnvironmentOverrides env;
    private final Supplier<Optional<? extends SecretStore>> secretStores;

    @Spec
    CommandSpec spec;

    @Option(names = {"--root"}, description = "Data root directory (default: $CHATVAULT_DATA_DIR or ./data)")
    String root;

    @Option(names = {"--tier"}, description = "Mode for a new database: open, secure or strict")
    String tier;

    public ChatVaultCommand() {
        this(EnvironmentOverrides.system(), () -> KeyringSecretStore.open(KeyManager.SERVICE));
    }

    public ChatVaultCommand(EnvironmentOverrides env, Supplier<Optional<? extends SecretStore>> secretStores) {
        this.env = env;
        this.secretStores = secretStores;
    }

    /** Command line with ChatVault's exit codes: fatal errors print one line and exit 1. */
    public static CommandLine commandLine(ChatVaultCommand command) {
        CommandLine cli = new CommandLine(command);
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            commandLine.getErr().println("error: " + describe(ex));
            commandLine.getErr().flush();
            return EXIT_FATAL;
        });
        return cli;
    }

    /** Data root named by {@code --root} in raw arguments, for setup that runs before parsing. */
    public static Optional<String> rootArgument(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals("--root") && i + 1 < args.length) {
                return Optional.of(args[i + 1]);
            }
            if (args[i].startsWith("--root=")) {
                return Optional.of(args[i].substring("--root=".length()));
            }
        }
        return Optional.empty();
    }

    @Override
    public void run() {
        out().println("Use subcommands: init | status | user-create | user-delete | user-role | login | signup-submit | signups | signup-approve | signup-reject | conversations | conversation-create | conversation-rename | conversation-delete | message-add | messages | cas-put | cas-path | cas-release | audit-verify");
        out().flush();
    }

    ChatVault vault() {
        Optional<Tier> requested = Optional.empty();
        if (tier != null && !tier.isBlank()) {
            requested = Optional.of(Tier.parse(tier).orElseThrow(() -> new CommandLine.ParameterException(
                    spec.commandLine(), "Unknown tier: " + tier + " (expected open, secure or strict)")));
        }
        TierSelector prompt = System.console() == null
                ? TierSelector.fixed(Tier.OPEN)
                : TierSelector.interactive(
                        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
        return ChatVault.open(config(), env, requested, prompt, secretStores.get());
    }

    ChatVaultConfig config() {
        return ChatVaultConfig.resolve(root, env);
    }

    int print(Object value) {
        out().println(Jsons.toJson(value));
        out().flush();
        return EXIT_OK;
    }

    int refuse(Object value) {
        out().println(Jsons.toJson(value));
        out().flush();
        return EXIT_REFUSED;
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    private static String describe(Throwable ex) {
        Throwable cause = ex;
        while (!(cause instanceof ChatVaultException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        Throwable shown = cause instanceof ChatVaultException ? cause : ex;
        return shown.getClass().getSimpleName() + ": " + shown.getMessage();
    }

    private static Map<String, Object> outcome(Object outcome, String idField, Object id) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("outcome", String.valueOf(outcome).toLowerCase(Locale.ROOT));
        if (id != null) {
            out.put(idField, id);
        }
        return out;
    }

    @Command(name = "init", description = "Create or verify the database; optionally create the first admin")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Option(names = {"--admin-user"}, description = "Username of the first admin, created if no admin exists")
        String adminUser;

        @Option(names = {"--admin-password"}, description = "Password of the first admin")
        String adminPassword;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("root", vault.config().rootDir().toString());
                out.put("mode", vault.tier().dbValue());
                if (adminUser != null && !adminUser.isBlank()) {
                    if (adminPassword == null || adminPassword.isEmpty()) {
                        throw new CommandLine.ParameterException(parent.spec.commandLine(),
                                "--admin-password is required with --admin-user");
                    }
                    Optional<CreateUserResult> created = vault.ensureAdmin(adminUser, adminPassword);
                    out.put("admin", created.map(r -> outcome(r.outcome(), "user_id", r.userId()))
                            .orElse(Map.of("outcome", "already_present")));
                }
                return parent.print(out);
            }
        }
    }

    @Command(name = "status", description = "Show database mode, schema version and admin presence")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                ChatVault.Status status = vault.status();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("mode", status.tier().dbValue());
                out.put("db_file", status.dbFile().toString());
                out.put("schema_version", status.schemaVersion());
                out.put("engine", status.engine().name().toLowerCase(Locale.ROOT));
                out.put("admins", status.adminCount());
                out.put("secret_store", status.secretStoreAvailable());
                out.put("signup_requires_approval", status.signupRequiresApproval());
                return parent.print(out);
            }
        }
    }

    @Command(name = "user-create", description = "Create a user account")
    static final class UserCreateCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "Username")
        String username;

        @Option(names = {"--password"}, required = true, description = "Password")
        String password;

        @Option(names = {"--name"}, description = "Display name (default: username)")
        String name;

        @Option(names = {"--handle"}, description = "Unique handle (default: username)")
        String handle;

        @Option(names = {"--email"}, description = "Email address")
        String email;

        @Option(names = {"--admin"}, description = "Grant the admin role")
        boolean admin;

        @Option(names = {"--actor"}, description = "User id performing the change, for the audit log")
        Long actor;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                CreateUserResult result = vault.createUser(
                        new NewUser(name, handle, email, username, password, admin ? Role.ADMIN : Role.USER), actor);
                Map<String, Object> out = outcome(result.outcome(), "user_id", result.userId());
                return result.created() ? parent.print(out) : parent.refuse(out);
            }
        }
    }

    @Command(name = "user-delete", description = "Delete a user; the last admin cannot be deleted")
    static final class UserDeleteCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "User id")
        long userId;

        @Option(names = {"--actor"}, description = "User id performing the change, for the audit log")
        Long actor;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                DeleteUserOutcome outcome = vault.deleteUser(userId, actor);
                Map<String, Object> out = outcome(outcome, "user_id", userId);
                return outcome == DeleteUserOutcome.DELETED ? parent.print(out) : parent.refuse(out);
            }
        }
    }

    @Command(name = "user-role", description = "Change a user's role; the last admin cannot be demoted")
    static final class UserRoleCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "User id")
        long userId;

        @Parameters(index = "1", description = "Role: user or admin")
        String role;

        @Option(names = {"--actor"}, description = "User id performing the change, for the audit log")
        Long actor;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                RoleChangeOutcome outcome = vault.setRole(userId, Role.fromDb(role), actor);
                Map<String, Object> out = outcome(outcome, "user_id", userId);
                boolean ok = outcome == RoleChangeOutcome.CHANGED || outcome == RoleChangeOutcome.UNCHANGED;
                return ok ? parent.print(out) : parent.refuse(out);
            }
        }
    }

    @Command(name = "login", description = "Check a username and password")
    static final class LoginCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "Username")
        String username;

        @Option(names = {"--password"}, required = true, description = "Password")
        String password;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                return vault.authenticate(username, password)
                        .map(user -> {
                            Map<String, Object> out = new LinkedHashMap<>();
                            out.put("outcome", "authenticated");
                            out.put("user_id", user.userId());
                            out.put("username", user.username());
                            out.put("role", user.role().dbValue());
                            return parent.print(out);
                        })
                        .orElseGet(() -> parent.refuse(Map.of("outcome", "invalid_credentials")));
            }
        }
    }

    @Command(name = "signup-submit", description = "Sign up; queued for approval unless the settings allow self-service")
    static final class SignupSubmitCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "Username")
        String username;

        @Option(names = {"--password"}, required = true, description = "Password")
        String password;

        @Option(names = {"--name"}, description = "Display name (default: username)")
        String name;

        @Option(names = {"--handle"}, description = "Unique handle (default: username)")
        String handle;

        @Option(names = {"--email"}, description = "Email address")
        String email;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                SignupSubmission result = vault.signUp(new NewUser(name, handle, email, username, password, Role.USER));
                Map<String, Object> out = outcome(result.outcome(), "request_id", result.requestId());
                if (result.userId() != null) {
                    out.put("user_id", result.userId());
                }
                return result.accepted() ? parent.print(out) : parent.refuse(out);
            }
        }
    }

    @Command(name = "signups", description = "List signup requests")
    static final class SignupsCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Option(names = {"--status"}, defaultValue = "pending", description = "pending, approved, rejected or all")
        String status;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            Optional<SignupStatus> filter = "all".equalsIgnoreCase(status)
                    ? Optional.empty()
                    : Optional.of(SignupStatus.fromDb(status));
            try (ChatVault vault = parent.vault()) {
                return parent.print(vault.listSignups(filter, limit));
            }
        }
    }

    @Command(name = "signup-approve", description = "Approve a pending signup request")
    static final class SignupApproveCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "Signup request id")
        long requestId;

        @Option(names = {"--admin"}, required = true, description = "Approving admin's user id")
        long adminId;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                SignupDecision decision = vault.approveSignup(requestId, adminId);
                Map<String, Object> out = outcome(decision.outcome(), "user_id", decision.userId());
                return decision.succeeded() ? parent.print(out) : parent.refuse(out);
            }
        }
    }

    @Command(name = "signup-reject", description = "Reject a pending signup request")
    static final class SignupRejectCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "Signup request id")
        long requestId;

        @Option(names = {"--admin"}, required = true, description = "Rejecting admin's user id")
        long adminId;

        @Option(names = {"--note"}, defaultValue = "", description = "Reason shown to operators")
        String note;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                SignupDecision decision = vault.rejectSignup(requestId, adminId, note);
                Map<String, Object> out = outcome(decision.outcome(), "request_id", requestId);
                return decision.succeeded() ? parent.print(out) : parent.refuse(out);
            }
        }
    }

    @Command(name = "conversations", description = "List a user's conversations, newest first")
    static final class ConversationsCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "User id")
        long userId;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                List<ConversationView> rows = vault.listConversations(userId, limit);
                return parent.print(rows);
            }
        }
    }

    @Command(name = "conversation-create", description = "Create a conversation")
    static final class ConversationCreateCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "Owner user id")
        long userId;

        @Option(names = {"--title"}, defaultValue = "New conversation", description = "Title")
        String title;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                NewConversationResult result = vault.createConversation(userId, title);
                if (!result.created()) {
                    return parent.refuse(outcome(result.outcome(), "user_id", userId));
                }
                return parent.print(outcome(result.outcome(), "conversation_id", result.conversationId()));
            }
        }
    }

    @Command(name = "conversation-rename", description = "Rename a conversation")
    static final class ConversationRenameCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "Conversation id")
        long conversationId;

        @Parameters(index = "1", description = "New title")
        String title;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                boolean renamed = vault.renameConversation(conversationId, title);
                Map<String, Object> out = outcome(renamed ? "renamed" : "not_found", "conversation_id", conversationId);
                return renamed ? parent.print(out) : parent.refuse(out);
            }
        }
    }

    @Command(name = "conversation-delete", description = "Delete a conversation and its messages")
    static final class ConversationDeleteCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "Conversation id")
        long conversationId;

        @Option(names = {"--actor"}, description = "User id performing the change, for the audit log")
        Long actor;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                boolean deleted = vault.deleteConversation(conversationId, actor);
                Map<String, Object> out = outcome(deleted ? "deleted" : "not_found", "conversation_id", conversationId);
                return deleted ? parent.print(out) : parent.refuse(out);
            }
        }
    }

    @Command(name = "message-add", description = "Append a message to a conversation")
    static final class MessageAddCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "Conversation id")
        long conversationId;

        @Parameters(index = "1", description = "Message text")
        String text;

        @Option(names = {"--sender"}, defaultValue = "user", description = "user, assistant, system or tool")
        String sender;

        @Option(names = {"--sender-id"}, description = "Sending user id")
        Long senderId;

        @Option(names = {"--meta"}, description = "Metadata entry key=value (repeatable)")
        Map<String, String> meta;

        @Override
        public Integer call() {
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (meta != null) {
                metadata.putAll(meta);
            }
            try (ChatVault vault = parent.vault()) {
                NewMessageResult result = vault.addMessage(
                        conversationId, SenderType.fromDb(sender), senderId, text, metadata);
                if (!result.added()) {
                    return parent.refuse(outcome(result.outcome(), "conversation_id", conversationId));
                }
                return parent.print(outcome(result.outcome(), "message_id", result.messageId()));
            }
        }
    }

    @Command(name = "messages", description = "List a conversation's messages, oldest first")
    static final class MessagesCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "Conversation id")
        long conversationId;

        @Option(names = {"--limit"}, defaultValue = "200", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                List<Map<String, Object>> rows = new ArrayList<>();
                for (MessageView message : vault.listMessages(conversationId, limit)) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("id", message.messageId());
                    row.put("sender_type", message.senderType().dbValue());
                    row.put("sender_id", message.senderId());
                    row.put("readable", message.body().readable());
                    row.put("content", message.body().orElse(""));
                    row.put("metadata", message.metadata());
                    row.put("created_at_ms", message.createdAtMs());
                    rows.add(row);
                }
                return parent.print(rows);
            }
        }
    }

    @Command(name = "cas-put", description = "Store a file in the content-addressable store")
    static final class CasPutCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "Source file")
        String source;

        @Option(names = {"--mime"}, description = "MIME type (default: probed)")
        String mime;

        @Option(names = {"--sha256"}, description = "Precomputed SHA-256 hex; the file is hashed when omitted")
        String sha256;

        @Override
        public Integer call() {
            Path path = Paths.get(source);
            try (ChatVault vault = parent.vault()) {
                long id = sha256 == null || sha256.isBlank()
                        ? vault.casPutFile(path, mime)
                        : vault.casPut(sha256, mime, path);
                Map<String, Object> out = outcome("stored", "file_id", id);
                vault.casFind(id).ifPresent(record -> {
                    out.put("sha256", record.sha256());
                    out.put("ref_count", record.refCount());
                });
                return parent.print(out);
            }
        }
    }

    @Command(name = "cas-path", description = "Print the blob path of a stored file")
    static final class CasPathCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "File id")
        long fileId;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                Optional<Path> path = vault.casPathFor(fileId);
                if (path.isEmpty()) {
                    return parent.refuse(outcome("not_found", "file_id", fileId));
                }
                Map<String, Object> out = outcome("found", "file_id", fileId);
                out.put("path", path.get().toString());
                return parent.print(out);
            }
        }
    }

    @Command(name = "cas-release", description = "Drop one reference to a stored file")
    static final class CasReleaseCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Parameters(index = "0", description = "File id")
        long fileId;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                boolean released = vault.casRelease(fileId);
                Map<String, Object> out = outcome(released ? "released" : "not_found", "file_id", fileId);
                return released ? parent.print(out) : parent.refuse(out);
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        ChatVaultCommand parent;

        @Override
        public Integer call() {
            try (ChatVault vault = parent.vault()) {
                AuditLog.ChainVerification result = vault.verifyAuditChain();
                return result.valid() ? parent.print(result) : parent.refuse(result);
            }
        }
    }
}
