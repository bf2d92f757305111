package io.chatvault.storage;

import io.chatvault.model.AuthenticatedUser;
import io.chatvault.model.CreateUserResult;
import io.chatvault.model.DeleteUserOutcome;
import io.chatvault.model.NewUser;
import io.chatvault.model.Role;
import io.chatvault.model.RoleChangeOutcome;
import io.chatvault.model.SignupDecision;
import io.chatvault.model.SignupStatus;
import io.chatvault.model.SignupSubmission;
import io.chatvault.model.SignupView;
import io.chatvault.model.UserView;
import io.chatvault.security.PasswordHasher;
import io.chatvault.security.PasswordHasher.PasswordHash;
import io.chatvault.storage.AuditLog.AuditEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * User profiles, credentials and the signup queue. Every multi-row change runs in one
 * transaction together with its audit row.
 */
public final class AccountStore {
    private static final Logger LOG = LoggerFactory.getLogger(AccountStore.class);

    private final Connection conn;
    private final PasswordHasher hasher;

    public AccountStore(Connection conn, PasswordHasher hasher) {
        this.conn = conn;
        this.hasher = hasher;
    }

    public CreateUserResult createUser(NewUser user, Long actorUserId) {
        PasswordHash credential = hasher.hash(user.password());
        long now = System.currentTimeMillis();
        try {
            conn.setAutoCommit(false);
            try {
                Optional<CreateUserResult.Outcome> duplicate = duplicateOf(user.username(), user.handle(), user.email());
                if (duplicate.isPresent()) {
                    conn.rollback();
                    return CreateUserResult.refused(duplicate.get());
                }
                long userId = insertAccount(user.name(), user.handle(), user.email(), user.username(),
                        user.role(), credential, now);
                AuditLog.append(conn, new AuditEvent(actorUserId, "user.create", "user:" + userId,
                        Map.of("username", user.username(), "role", user.role().dbValue())));
                conn.commit();
                LOG.info("Created user {} with role {}", userId, user.role().dbValue());
                return CreateUserResult.created(userId);
            } catch (Exception e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to create user", e);
        }
    }

    /**
     * Verifies a password. An unknown username still costs one key derivation, so the
     * response time does not tell which half of the credential was wrong.
     */
    public Optional<AuthenticatedUser> authenticate(String username, String password) {
        if (username == null || password == null) {
            return Optional.empty();
        }
        try {
            long userId;
            Role role;
            PasswordHash stored;
            try (PreparedStatement ps = conn.prepareStatement("""
                    SELECT id, role, pw_salt, pw_hash, pw_params FROM user_auth WHERE username=?
                    """)) {
                ps.setString(1, username.trim());
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        hasher.verifyDecoy(password);
                        return Optional.empty();
                    }
                    userId = rs.getLong("id");
                    role = Role.fromDb(rs.getString("role"));
                    stored = new PasswordHash(
                            rs.getBytes("pw_salt"),
                            rs.getBytes("pw_hash"),
                            PasswordHasher.Params.decode(rs.getString("pw_params"))
                    );
                }
            }
            if (!hasher.verify(password, stored)) {
                return Optional.empty();
            }
            long now = System.currentTimeMillis();
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE user_auth SET last_login_at_ms=?, updated_at_ms=? WHERE id=?")) {
                ps.setLong(1, now);
                ps.setLong(2, now);
                ps.setLong(3, userId);
                ps.executeUpdate();
            }
            return Optional.of(new AuthenticatedUser(userId, username.trim(), role));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to authenticate user", e);
        }
    }

    public SignupSubmission submitSignup(NewUser user) {
        PasswordHash credential = hasher.hash(user.password());
        long now = System.currentTimeMillis();
        try {
            conn.setAutoCommit(false);
            try {
                Optional<SignupSubmission.Outcome> taken = takenBySignupOrUser(user);
                if (taken.isPresent()) {
                    conn.rollback();
                    return SignupSubmission.refused(taken.get());
                }
                long requestId;
                try (PreparedStatement ps = conn.prepareStatement("""
                        INSERT INTO signup_request(name, handle, username, email, pw_salt, pw_hash, pw_params,
                                                   created_at_ms, status)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, 'pending')
                        """)) {
                    ps.setString(1, user.name());
                    ps.setString(2, user.handle());
                    ps.setString(3, user.username());
                    Rows.setNullableString(ps, 4, user.email());
                    ps.setBytes(5, credential.salt());
                    ps.setBytes(6, credential.hash());
                    ps.setString(7, credential.params().encode());
                    ps.setLong(8, now);
                    ps.executeUpdate();
                }
                requestId = Rows.lastInsertId(conn);
                AuditLog.append(conn, new AuditEvent(null, "signup.submit", "signup:" + requestId,
                        Map.of("username", user.username())));
                conn.commit();
                return SignupSubmission.submitted(requestId);
            } catch (Exception e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to submit signup request", e);
        }
    }

    /** Requests in submission order; an empty status lists every request. */
    public List<SignupView> listSignups(Optional<SignupStatus> status, int limit) {
        String sql = """
                SELECT id, name, handle, username, email, status, created_at_ms, decided_by, decided_at_ms, note
                FROM signup_request
                """ + (status.isPresent() ? "WHERE status=? " : "") + "ORDER BY created_at_ms ASC, id ASC LIMIT ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            if (status.isPresent()) {
                ps.setString(i++, status.get().dbValue());
            }
            ps.setInt(i, Math.max(1, limit));
            List<SignupView> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SignupView(
                            rs.getLong("id"),
                            rs.getString("name"),
                            rs.getString("handle"),
                            rs.getString("username"),
                            rs.getString("email"),
                            SignupStatus.fromDb(rs.getString("status")),
                            rs.getLong("created_at_ms"),
                            Rows.nullableLong(rs, "decided_by"),
                            Rows.nullableLong(rs, "decided_at_ms"),
                            rs.getString("note")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list signup requests", e);
        }
    }

    /**
     * Promotes a pending request into a user. Profile, credentials and the status flip
     * commit together or not at all.
     */
    public SignupDecision approveSignup(long requestId, long adminUserId) {
        try {
            conn.setAutoCommit(false);
            try {
                Optional<SignupDecision.Outcome> refusal = decisionRefusal(requestId, adminUserId);
                if (refusal.isPresent()) {
                    conn.rollback();
                    return SignupDecision.of(refusal.get());
                }
                String name;
                String handle;
                String username;
                String email;
                PasswordHash credential;
                try (PreparedStatement ps = conn.prepareStatement("""
                        SELECT name, handle, username, email, pw_salt, pw_hash, pw_params
                        FROM signup_request WHERE id=?
                        """)) {
                    ps.setLong(1, requestId);
                    try (ResultSet rs = ps.executeQuery()) {
                        rs.next();
                        name = rs.getString("name");
                        handle = rs.getString("handle");
                        username = rs.getString("username");
                        email = rs.getString("email");
                        credential = new PasswordHash(
                                rs.getBytes("pw_salt"),
                                rs.getBytes("pw_hash"),
                                PasswordHasher.Params.decode(rs.getString("pw_params"))
                        );
                    }
                }
                Optional<CreateUserResult.Outcome> duplicate = duplicateOf(username, handle, email);
                if (duplicate.isPresent()) {
                    conn.rollback();
                    return SignupDecision.of(switch (duplicate.get()) {
                        case DUPLICATE_HANDLE -> SignupDecision.Outcome.DUPLICATE_HANDLE;
                        case DUPLICATE_EMAIL -> SignupDecision.Outcome.DUPLICATE_EMAIL;
                        default -> SignupDecision.Outcome.DUPLICATE_USERNAME;
                    });
                }
                long now = System.currentTimeMillis();
                long userId = insertAccount(name, handle, email, username, Role.USER, credential, now);
                try (PreparedStatement ps = conn.prepareStatement("""
                        UPDATE signup_request SET status='approved', decided_by=?, decided_at_ms=?
                        WHERE id=? AND status='pending'
                        """)) {
                    ps.setLong(1, adminUserId);
                    ps.setLong(2, now);
                    ps.setLong(3, requestId);
                    if (ps.executeUpdate() != 1) {
                        throw new IllegalStateException("Signup request changed during approval: " + requestId);
                    }
                }
                AuditLog.append(conn, new AuditEvent(adminUserId, "signup.approve", "signup:" + requestId,
                        Map.of("user_id", userId, "username", username)));
                conn.commit();
                LOG.info("Approved signup request {} as user {}", requestId, userId);
                return SignupDecision.approved(userId);
            } catch (Exception e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to approve signup request " + requestId, e);
        }
    }

    public SignupDecision rejectSignup(long requestId, long adminUserId, String note) {
        try {
            conn.setAutoCommit(false);
            try {
                Optional<SignupDecision.Outcome> refusal = decisionRefusal(requestId, adminUserId);
                if (refusal.isPresent()) {
                    conn.rollback();
                    return SignupDecision.of(refusal.get());
                }
                try (PreparedStatement ps = conn.prepareStatement("""
                        UPDATE signup_request SET status='rejected', decided_by=?, decided_at_ms=?, note=?
                        WHERE id=? AND status='pending'
                        """)) {
                    ps.setLong(1, adminUserId);
                    ps.setLong(2, System.currentTimeMillis());
                    ps.setString(3, note == null ? "" : note);
                    ps.setLong(4, requestId);
                    ps.executeUpdate();
                }
                AuditLog.append(conn, AuditEvent.of(adminUserId, "signup.reject", "signup:" + requestId));
                conn.commit();
                return SignupDecision.of(SignupDecision.Outcome.REJECTED);
            } catch (Exception e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to reject signup request " + requestId, e);
        }
    }

    /** Deletes a user and, through cascades, their conversations. The last admin stays. */
    public DeleteUserOutcome deleteUser(long userId, Long actorUserId) {
        try {
            conn.setAutoCommit(false);
            try {
                Optional<Role> role = roleOf(userId);
                if (role.isEmpty()) {
                    conn.rollback();
                    return DeleteUserOutcome.NOT_FOUND;
                }
                if (role.get() == Role.ADMIN && countAdmins(conn) <= 1) {
                    conn.rollback();
                    return DeleteUserOutcome.LAST_ADMIN;
                }
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM user_profile WHERE id=?")) {
                    ps.setLong(1, userId);
                    ps.executeUpdate();
                }
                AuditLog.append(conn, AuditEvent.of(actorUserId, "user.delete", "user:" + userId));
                conn.commit();
                LOG.info("Deleted user {}", userId);
                return DeleteUserOutcome.DELETED;
            } catch (Exception e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to delete user " + userId, e);
        }
    }

    public RoleChangeOutcome setRole(long userId, Role role, Long actorUserId) {
        try {
            conn.setAutoCommit(false);
            try {
                Optional<Role> current = roleOf(userId);
                if (current.isEmpty()) {
                    conn.rollback();
                    return RoleChangeOutcome.NOT_FOUND;
                }
                if (current.get() == role) {
                    conn.rollback();
                    return RoleChangeOutcome.UNCHANGED;
                }
                if (current.get() == Role.ADMIN && countAdmins(conn) <= 1) {
                    conn.rollback();
                    return RoleChangeOutcome.LAST_ADMIN;
                }
                try (PreparedStatement ps = conn.prepareStatement(
                        "UPDATE user_auth SET role=?, updated_at_ms=? WHERE id=?")) {
                    ps.setString(1, role.dbValue());
                    ps.setLong(2, System.currentTimeMillis());
                    ps.setLong(3, userId);
                    ps.executeUpdate();
                }
                AuditLog.append(conn, new AuditEvent(actorUserId, "user.role", "user:" + userId,
                        Map.of("from", current.get().dbValue(), "to", role.dbValue())));
                conn.commit();
                return RoleChangeOutcome.CHANGED;
            } catch (Exception e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to change role of user " + userId, e);
        }
    }

    public Optional<UserView> findUser(long userId) {
        try (PreparedStatement ps = conn.prepareStatement("""
                SELECT p.id, p.name, p.handle, p.email, a.username, a.role, p.created_at_ms, a.last_login_at_ms
                FROM user_profile p JOIN user_auth a ON a.id = p.id
                WHERE p.id=?
                """)) {
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new UserView(
                        rs.getLong("id"),
                        rs.getString("name"),
                        rs.getString("handle"),
                        rs.getString("email"),
                        rs.getString("username"),
                        Role.fromDb(rs.getString("role")),
                        rs.getLong("created_at_ms"),
                        Rows.nullableLong(rs, "last_login_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read user " + userId, e);
        }
    }

    public int countAdmins() {
        return countAdmins(conn);
    }

    public boolean hasAdmin() {
        return countAdmins(conn) > 0;
    }

    static int countAdmins(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM user_auth WHERE role='admin'");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count admins", e);
        }
    }

    private long insertAccount(
            String name,
            String handle,
            String email,
            String username,
            Role role,
            PasswordHash credential,
            long now
    ) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("""
                INSERT INTO user_profile(name, handle, email, created_at_ms, updated_at_ms)
                VALUES (?, ?, ?, ?, ?)
                """)) {
            ps.setString(1, name);
            ps.setString(2, handle);
            Rows.setNullableString(ps, 3, email);
            ps.setLong(4, now);
            ps.setLong(5, now);
            ps.executeUpdate();
        }
        long userId = Rows.lastInsertId(conn);
        try (PreparedStatement ps = conn.prepareStatement("""
                INSERT INTO user_auth(id, username, role, pw_salt, pw_hash, pw_params, created_at_ms, updated_at_ms)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """)) {
            ps.setLong(1, userId);
            ps.setString(2, username);
            ps.setString(3, role.dbValue());
            ps.setBytes(4, credential.salt());
            ps.setBytes(5, credential.hash());
            ps.setString(6, credential.params().encode());
            ps.setLong(7, now);
            ps.setLong(8, now);
            ps.executeUpdate();
        }
        return userId;
    }

    private Optional<CreateUserResult.Outcome> duplicateOf(String username, String handle, String email)
            throws SQLException {
        if (Rows.exists(conn, "SELECT 1 FROM user_auth WHERE username=?", username)) {
            return Optional.of(CreateUserResult.Outcome.DUPLICATE_USERNAME);
        }
        if (Rows.exists(conn, "SELECT 1 FROM user_profile WHERE handle=?", handle)) {
            return Optional.of(CreateUserResult.Outcome.DUPLICATE_HANDLE);
        }
        if (email != null && Rows.exists(conn, "SELECT 1 FROM user_profile WHERE email=?", email)) {
            return Optional.of(CreateUserResult.Outcome.DUPLICATE_EMAIL);
        }
        return Optional.empty();
    }

    private Optional<SignupSubmission.Outcome> takenBySignupOrUser(NewUser user) throws SQLException {
        Optional<CreateUserResult.Outcome> duplicate = duplicateOf(user.username(), user.handle(), user.email());
        if (duplicate.isPresent()) {
            return Optional.of(switch (duplicate.get()) {
                case DUPLICATE_HANDLE -> SignupSubmission.Outcome.HANDLE_TAKEN;
                case DUPLICATE_EMAIL -> SignupSubmission.Outcome.EMAIL_TAKEN;
                default -> SignupSubmission.Outcome.USERNAME_TAKEN;
            });
        }
        if (Rows.exists(conn, "SELECT 1 FROM signup_request WHERE status='pending' AND username=?", user.username())) {
            return Optional.of(SignupSubmission.Outcome.USERNAME_TAKEN);
        }
        if (Rows.exists(conn, "SELECT 1 FROM signup_request WHERE status='pending' AND handle=?", user.handle())) {
            return Optional.of(SignupSubmission.Outcome.HANDLE_TAKEN);
        }
        return Optional.empty();
    }

    private Optional<SignupDecision.Outcome> decisionRefusal(long requestId, long adminUserId) throws SQLException {
        if (roleOf(adminUserId).orElse(Role.USER) != Role.ADMIN) {
            return Optional.of(SignupDecision.Outcome.NOT_AUTHORIZED);
        }
        try (PreparedStatement ps = conn.prepareStatement("SELECT status FROM signup_request WHERE id=?")) {
            ps.setLong(1, requestId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.of(SignupDecision.Outcome.NOT_FOUND);
                }
                if (SignupStatus.fromDb(rs.getString(1)) != SignupStatus.PENDING) {
                    return Optional.of(SignupDecision.Outcome.NOT_PENDING);
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Role> roleOf(long userId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT role FROM user_auth WHERE id=?")) {
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(Role.fromDb(rs.getString(1))) : Optional.empty();
            }
        }
    }
}
