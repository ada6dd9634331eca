package de.bsommerfeld.pseat.db;

import de.bsommerfeld.pseat.core.domain.UserOffenses;

/**
 * Composite key of a {@link UserOffenses} row.
 */
public record UserKey(long guildId, long channelId, long userId) {

    public static UserKey of(UserOffenses user) {
        return new UserKey(user.guildId(), user.channelId(), user.userId());
    }

    /** The channel whose user listing contains this key. */
    public ChannelKey channel() {
        return new ChannelKey(guildId, channelId);
    }

    @Override
    public String toString() {
        return guildId + "/" + channelId + "/" + userId;
    }
}
