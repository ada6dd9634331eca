package de.bsommerfeld.pseat.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.pseat.core.config.DatabaseConfig;
import de.bsommerfeld.pseat.core.domain.ChannelConfig;
import de.bsommerfeld.pseat.core.domain.UserOffenses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed {@link DatabaseService} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} every time a store is opened.
 * Every DDL statement uses {@code CREATE TABLE IF NOT EXISTS}, so re-opening
 * an existing file leaves it untouched.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after, on every exit path. SQLite serializes writes at the file level;
 * connections are opened with a busy timeout so a second writer waits for
 * the lock instead of failing right away. Within the process, writes are
 * additionally serialized by {@link #writeLock}.
 *
 * <h3>Transaction boundaries</h3>
 * Upserts run as delete + insert in one explicit transaction with
 * rollback-on-failure. Reads use auto-commit.
 *
 * <h3>Failures</h3>
 * Every {@link SQLException} is logged with its key and rethrown as
 * {@link StorageUnavailableException}.
 *
 * @see SqlLoader
 * @see RulesRepository
 */
@Singleton
public class SqlDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);

    public static final int DEFAULT_BUSY_TIMEOUT_MILLIS = 5000;

    private final Path dbFile;
    private final String dbUrl;
    private final Properties connectionProperties;
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * Opens the store configured in {@code config}, resolving a relative file
     * name against the application data directory.
     */
    @Inject
    public SqlDatabaseService(DatabaseConfig config, @Named(RulesModule.DATA_DIR) Path dataDir) {
        this(config.resolveFile(dataDir), config.getBusyTimeoutMillis());
    }

    public SqlDatabaseService(Path dbFile) {
        this(dbFile, DEFAULT_BUSY_TIMEOUT_MILLIS);
    }

    /**
     * Opens (and if necessary creates) the store at {@code dbFile}, creating
     * missing parent directories, and applies the schema.
     *
     * @throws StorageUnavailableException if the directory cannot be created
     *                                     or the file cannot be opened
     */
    public SqlDatabaseService(Path dbFile, int busyTimeoutMillis) {
        this.dbFile = dbFile.toAbsolutePath();
        this.dbUrl = "jdbc:sqlite:" + this.dbFile;

        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.setBusyTimeout(busyTimeoutMillis);
        sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
        this.connectionProperties = sqliteConfig.toProperties();

        createParentDirectories();
        initialize();
    }

    public Path getDbFile() {
        return dbFile;
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl, connectionProperties);
    }

    private void createParentDirectories() {
        Path parent = dbFile.getParent();
        if (parent == null || Files.isDirectory(parent))
            return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            LOG.error("Failed to create database directory {}", parent, e);
            throw new StorageUnavailableException("Cannot create database directory " + parent, e);
        }
    }

    private void initialize() {
        LOG.info("Initializing Database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            LOG.error("Database initialization failed for {}", dbFile, e);
            throw new StorageUnavailableException("Cannot open database " + dbFile, e);
        }
        LOG.info("Database ready: {} channel configs, {} user records.", countConfigs(), countUsers());
    }

    /** Applies every statement of {@code schema.sql} in one transaction. */
    private void applySchema(Connection conn) throws SQLException {
        List<String> schema = SqlLoader.loadScript("schema.sql");
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schema) {
                stmt.execute(sql);
            }
            conn.commit();
            LOG.info("Database schema applied.");
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        }
    }

    // =====================================================================
    // Channel Configs
    // =====================================================================

    @Override
    public Optional<ChannelConfig> getConfig(long guildId, long channelId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-config"))) {
            ps.setLong(1, guildId);
            ps.setLong(2, channelId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapConfig(rs));
                }
            }
        } catch (SQLException e) {
            LOG.error("Failed to fetch config {}/{}", guildId, channelId, e);
            throw new StorageUnavailableException("Cannot read config " + guildId + "/" + channelId, e);
        }
        return Optional.empty();
    }

    @Override
    public void putConfig(ChannelConfig config) {
        writeLock.lock();
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                deleteConfig(conn, config.guildId(), config.channelId());
                insertConfig(conn, config);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            LOG.debug("[DB] Saved config {}/{}", config.guildId(), config.channelId());
        } catch (SQLException e) {
            LOG.error("Failed to save config {}/{}", config.guildId(), config.channelId(), e);
            throw new StorageUnavailableException(
                    "Cannot write config " + config.guildId() + "/" + config.channelId(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private void deleteConfig(Connection conn, long guildId, long channelId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-config"))) {
            ps.setLong(1, guildId);
            ps.setLong(2, channelId);
            ps.executeUpdate();
        }
    }

    private void insertConfig(Connection conn, ChannelConfig c) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-config"))) {
            ps.setLong(1, c.guildId());
            ps.setLong(2, c.channelId());
            ps.setDouble(3, c.eventExpectancy());
            ps.setLong(4, c.eventDuration());
            ps.setDouble(5, c.eventCooldown());
            ps.setLong(6, c.lastEvent());
            ps.setLong(7, c.maxOffenses());
            ps.setLong(8, c.timeoutDuration());
            ps.setString(9, c.prefixes());
            ps.executeUpdate();
        }
    }

    // =====================================================================
    // User Offenses
    // =====================================================================

    @Override
    public Optional<UserOffenses> getUser(long guildId, long channelId, long userId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-user"))) {
            ps.setLong(1, guildId);
            ps.setLong(2, channelId);
            ps.setLong(3, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapUser(rs));
                }
            }
        } catch (SQLException e) {
            LOG.error("Failed to fetch user {}/{}/{}", guildId, channelId, userId, e);
            throw new StorageUnavailableException(
                    "Cannot read user " + guildId + "/" + channelId + "/" + userId, e);
        }
        return Optional.empty();
    }

    @Override
    public void putUser(UserOffenses user) {
        writeLock.lock();
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                deleteUser(conn, user.guildId(), user.channelId(), user.userId());
                insertUser(conn, user);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            LOG.debug("[DB] Saved user {}/{}/{}", user.guildId(), user.channelId(), user.userId());
        } catch (SQLException e) {
            LOG.error("Failed to save user {}/{}/{}", user.guildId(), user.channelId(), user.userId(), e);
            throw new StorageUnavailableException(
                    "Cannot write user " + user.guildId() + "/" + user.channelId() + "/" + user.userId(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<UserOffenses> listUsers(long guildId, long channelId) {
        List<UserOffenses> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-users-for-channel"))) {
            ps.setLong(1, guildId);
            ps.setLong(2, channelId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapUser(rs));
                }
            }
        } catch (SQLException e) {
            LOG.error("Failed to list users of {}/{}", guildId, channelId, e);
            throw new StorageUnavailableException("Cannot list users of " + guildId + "/" + channelId, e);
        }
        return result;
    }

    private void deleteUser(Connection conn, long guildId, long channelId, long userId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-user"))) {
            ps.setLong(1, guildId);
            ps.setLong(2, channelId);
            ps.setLong(3, userId);
            ps.executeUpdate();
        }
    }

    private void insertUser(Connection conn, UserOffenses u) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-user"))) {
            ps.setLong(1, u.guildId());
            ps.setLong(2, u.channelId());
            ps.setLong(3, u.userId());
            ps.setLong(4, u.currentOffenses());
            ps.setLong(5, u.totalOffenses());
            ps.setLong(6, u.lastOffense());
            ps.executeUpdate();
        }
    }

    // =====================================================================
    // Diagnostics
    // =====================================================================

    @Override
    public int countConfigs() {
        return count("count-configs");
    }

    @Override
    public int countUsers() {
        return count("count-users");
    }

    private int count(String statement) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement));
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            LOG.error("Failed to execute {}", statement, e);
            throw new StorageUnavailableException("Cannot execute " + statement, e);
        }
    }

    // =====================================================================
    // ResultSet → Domain Mapping
    // =====================================================================

    private ChannelConfig mapConfig(ResultSet rs) throws SQLException {
        return new ChannelConfig(
                rs.getLong("guild_id"), rs.getLong("channel_id"),
                rs.getDouble("event_expectancy"), rs.getLong("event_duration"),
                rs.getDouble("event_cooldown"), rs.getLong("last_event"),
                rs.getLong("max_offenses"), rs.getLong("timeout_duration"),
                rs.getString("prefixes"));
    }

    private UserOffenses mapUser(ResultSet rs) throws SQLException {
        return new UserOffenses(
                rs.getLong("guild_id"), rs.getLong("channel_id"), rs.getLong("user_id"),
                rs.getLong("current_offenses"), rs.getLong("total_offenses"),
                rs.getLong("last_offense"));
    }
}
