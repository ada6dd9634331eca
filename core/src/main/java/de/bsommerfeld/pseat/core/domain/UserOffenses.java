package de.bsommerfeld.pseat.core.domain;

/**
 * Offense counters of one user in one channel. Keyed by
 * {@code (guildId, channelId, userId)}; a write replaces the whole row.
 *
 * <p>
 * {@code currentOffenses} is the window counter that a collaborator resets
 * periodically, while {@code totalOffenses} only ever grows. Both
 * {@link #recordOffense(long)} and {@link #resetCurrentOffenses()} keep that
 * contract; the raw {@code with...} methods do not check it.
 *
 * @param guildId         owning guild
 * @param channelId       channel the offenses were committed in
 * @param userId          offending user
 * @param currentOffenses offenses since the last reset
 * @param totalOffenses   offenses over the record's lifetime
 * @param lastOffense     epoch seconds of the latest offense, 0 if none
 */
public record UserOffenses(
        long guildId,
        long channelId,
        long userId,
        long currentOffenses,
        long totalOffenses,
        long lastOffense) {

    /** A record with all counters at zero, for users without history. */
    public static UserOffenses empty(long guildId, long channelId, long userId) {
        return new UserOffenses(guildId, channelId, userId, 0L, 0L, 0L);
    }

    /** Counts one more offense committed at {@code timestamp}. */
    public UserOffenses recordOffense(long timestamp) {
        return new UserOffenses(guildId, channelId, userId,
                currentOffenses + 1, totalOffenses + 1, timestamp);
    }

    public UserOffenses resetCurrentOffenses() {
        return withCurrentOffenses(0L);
    }

    public UserOffenses withCurrentOffenses(long currentOffenses) {
        return new UserOffenses(guildId, channelId, userId, currentOffenses, totalOffenses, lastOffense);
    }

    public UserOffenses withTotalOffenses(long totalOffenses) {
        return new UserOffenses(guildId, channelId, userId, currentOffenses, totalOffenses, lastOffense);
    }

    public UserOffenses withLastOffense(long lastOffense) {
        return new UserOffenses(guildId, channelId, userId, currentOffenses, totalOffenses, lastOffense);
    }
}
