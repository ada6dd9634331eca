package de.bsommerfeld.pseat.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.pseat.core.config.DefaultsConfig;
import de.bsommerfeld.pseat.core.domain.ChannelConfig;
import de.bsommerfeld.pseat.core.domain.UserOffenses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Read-through caching layer over {@link DatabaseService}.
 *
 * <p>
 * This is the single point of access for channel policies and offense
 * counters. Command handlers never talk to {@code DatabaseService} directly.
 *
 * <h3>Caches</h3>
 * Three {@link MemoizingCache}s, one per read operation, created with the
 * repository and cleared by {@link #shutdown()}:
 * <ul>
 * <li>{@code config}: {@link #getConfig}, keyed by {@link ChannelKey}</li>
 * <li>{@code user}: {@link #getUser}, keyed by {@link UserKey}</li>
 * <li>{@code users}: {@link #getUsers}, keyed by {@link ChannelKey}</li>
 * </ul>
 * Absent rows are cached as {@link Optional#empty()}.
 *
 * <h3>Writes</h3>
 * A write goes to the store first and then evicts every entry it may have
 * made stale: {@link #updateConfig} evicts the config entry of its key,
 * {@link #updateUser} evicts the user entry of its key and the user listing
 * of its channel. Eviction finishes before the write returns, so a read
 * issued afterwards always sees the new row. Writes never populate the
 * cache; the next read does.
 *
 * <h3>Threading model</h3>
 * All methods are safe to call from any thread and block on SQLite I/O.
 * Callers that must not block use the {@code ...Async} variants, which run
 * on a dedicated single-thread executor.
 *
 * <h3>Record immutability</h3>
 * There are no partial updates. Callers read the current record, derive a
 * copy via its {@code with...} methods and write the whole record back.
 */
@Singleton
public class RulesRepository {

    private static final Logger LOG = LoggerFactory.getLogger(RulesRepository.class);

    private final DatabaseService databaseService;
    private final DefaultsConfig defaults;
    private final ExecutorService dbExecutor = Executors.newSingleThreadExecutor();

    private final MemoizingCache<ChannelKey, Optional<ChannelConfig>> configCache = new MemoizingCache<>("config");
    private final MemoizingCache<UserKey, Optional<UserOffenses>> userCache = new MemoizingCache<>("user");
    private final MemoizingCache<ChannelKey, List<UserOffenses>> usersCache = new MemoizingCache<>("users");

    @Inject
    public RulesRepository(DatabaseService databaseService, DefaultsConfig defaults) {
        this.databaseService = databaseService;
        this.defaults = defaults;
    }

    public RulesRepository(DatabaseService databaseService) {
        this(databaseService, new DefaultsConfig());
    }

    /**
     * Drains pending async operations (up to 30s), shuts down the executor and
     * drops all cached entries.
     */
    public void shutdown() {
        LOG.info("Shutting down RulesRepository...");
        dbExecutor.shutdown();
        try {
            if (!dbExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                dbExecutor.shutdownNow();
                LOG.warn("RulesRepository forced shutdown (timed out).");
            }
        } catch (InterruptedException e) {
            dbExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        configCache.clear();
        userCache.clear();
        usersCache.clear();
    }

    // -- Channel Configs --

    /**
     * Replaces the stored policy for the config's channel and evicts its cache
     * entry.
     *
     * @throws InvalidRecordException      if {@code config} or its prefixes are
     *                                     {@code null}
     * @throws StorageUnavailableException if the store cannot be written; the
     *                                     cache is left untouched
     */
    public void updateConfig(ChannelConfig config) {
        requireValid(config);
        databaseService.putConfig(config);
        configCache.invalidate(ChannelKey.of(config));
    }

    /**
     * Returns the stored policy for the channel, or empty if it was never
     * configured. Served from cache after the first lookup.
     */
    public Optional<ChannelConfig> getConfig(long guildId, long channelId) {
        return configCache.get(new ChannelKey(guildId, channelId),
                key -> databaseService.getConfig(key.guildId(), key.channelId()));
    }

    /**
     * Returns the stored policy, or the configured default policy if the
     * channel was never configured. The default is not written.
     */
    public ChannelConfig getConfigOrDefault(long guildId, long channelId) {
        return getConfig(guildId, channelId)
                .orElseGet(() -> ChannelConfig.defaults(guildId, channelId, defaults));
    }

    // -- User Offenses --

    /**
     * Replaces the stored record for the user and evicts both the user's entry
     * and the user listing of its channel.
     *
     * @throws InvalidRecordException      if {@code user} is {@code null}
     * @throws StorageUnavailableException if the store cannot be written
     */
    public void updateUser(UserOffenses user) {
        requireValid(user);
        databaseService.putUser(user);
        UserKey key = UserKey.of(user);
        userCache.invalidate(key);
        usersCache.invalidate(key.channel());
    }

    /**
     * Returns the user's record in the channel, or empty if none exists.
     */
    public Optional<UserOffenses> getUser(long guildId, long channelId, long userId) {
        return userCache.get(new UserKey(guildId, channelId, userId),
                key -> databaseService.getUser(key.guildId(), key.channelId(), key.userId()));
    }

    /**
     * Returns all user records of the channel as an unmodifiable list in no
     * particular order; empty if there are none.
     */
    public List<UserOffenses> getUsers(long guildId, long channelId) {
        return usersCache.get(new ChannelKey(guildId, channelId),
                key -> List.copyOf(databaseService.listUsers(key.guildId(), key.channelId())));
    }

    // -- Async variants --

    public CompletableFuture<Void> updateConfigAsync(ChannelConfig config) {
        return CompletableFuture.runAsync(() -> updateConfig(config), dbExecutor);
    }

    public CompletableFuture<Optional<ChannelConfig>> getConfigAsync(long guildId, long channelId) {
        return CompletableFuture.supplyAsync(() -> getConfig(guildId, channelId), dbExecutor);
    }

    public CompletableFuture<Void> updateUserAsync(UserOffenses user) {
        return CompletableFuture.runAsync(() -> updateUser(user), dbExecutor);
    }

    public CompletableFuture<Optional<UserOffenses>> getUserAsync(long guildId, long channelId, long userId) {
        return CompletableFuture.supplyAsync(() -> getUser(guildId, channelId, userId), dbExecutor);
    }

    public CompletableFuture<List<UserOffenses>> getUsersAsync(long guildId, long channelId) {
        return CompletableFuture.supplyAsync(() -> getUsers(guildId, channelId), dbExecutor);
    }

    // -- Cache statistics --

    public CacheStats configCacheStats() {
        return configCache.stats();
    }

    public CacheStats userCacheStats() {
        return userCache.stats();
    }

    public CacheStats usersCacheStats() {
        return usersCache.stats();
    }

    private static void requireValid(ChannelConfig config) {
        if (config == null)
            throw new InvalidRecordException("Channel config must not be null");
        if (config.prefixes() == null)
            throw new InvalidRecordException(
                    "Channel config " + ChannelKey.of(config) + " has no prefixes (use \"\" for none)");
    }

    private static void requireValid(UserOffenses user) {
        if (user == null)
            throw new InvalidRecordException("User offenses must not be null");
    }
}
