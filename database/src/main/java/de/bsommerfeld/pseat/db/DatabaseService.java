package de.bsommerfeld.pseat.db;

import de.bsommerfeld.pseat.core.domain.ChannelConfig;
import de.bsommerfeld.pseat.core.domain.UserOffenses;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for channel policies and user offense counters. All
 * implementations must be thread-safe; {@link RulesRepository} calls them
 * from any caller thread as well as from its own database executor.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlDatabaseService}: production persistence via SQLite</li>
 * <li>{@link TestDatabaseService}: in-memory store for TEST mode, no disk
 * I/O</li>
 * </ul>
 *
 * <p>
 * Callers go through {@link RulesRepository}, which adds caching and
 * invalidation on top of this contract. Absence is reported as an empty
 * result, never as an exception. Failures of the store itself surface as
 * {@link StorageUnavailableException}.
 */
public interface DatabaseService {

    /**
     * Returns the policy stored for the channel, or empty if none was ever
     * written.
     */
    Optional<ChannelConfig> getConfig(long guildId, long channelId);

    /**
     * Replaces the stored policy for {@code (guildId, channelId)} with
     * {@code config}. The old row is removed and the new one inserted as one
     * atomic unit; readers see either the old or the new row, never both or
     * neither.
     */
    void putConfig(ChannelConfig config);

    /**
     * Returns the offense record for the user in the channel, or empty if none
     * was ever written.
     */
    Optional<UserOffenses> getUser(long guildId, long channelId, long userId);

    /**
     * Replaces the stored record for {@code (guildId, channelId, userId)},
     * with the same atomicity as {@link #putConfig}.
     */
    void putUser(UserOffenses user);

    /**
     * Returns every user record stored for the channel, in no particular
     * order. Records of other channels in the same guild are not included.
     */
    List<UserOffenses> listUsers(long guildId, long channelId);

    /** Number of stored channel policies. */
    int countConfigs();

    /** Number of stored user records across all channels. */
    int countUsers();
}
