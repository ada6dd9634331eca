package de.bsommerfeld.pseat.db;

import de.bsommerfeld.pseat.core.domain.ChannelConfig;

/**
 * Composite key of a channel: identifies a {@link ChannelConfig} row and the
 * set of user records listed for that channel.
 */
public record ChannelKey(long guildId, long channelId) {

    public static ChannelKey of(ChannelConfig config) {
        return new ChannelKey(config.guildId(), config.channelId());
    }

    @Override
    public String toString() {
        return guildId + "/" + channelId;
    }
}
