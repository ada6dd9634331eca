package de.bsommerfeld.pseat.core.domain;

import de.bsommerfeld.pseat.core.config.DefaultsConfig;
import de.bsommerfeld.pseat.core.util.PrefixParser;

import java.util.List;

/**
 * Moderation policy of a single channel. There is at most one stored config
 * per {@code (guildId, channelId)} pair, and every write replaces the whole
 * row. Timestamps are Unix epoch seconds (UTC).
 *
 * <p>
 * Since this is a record, changing a field means building a new value. Use
 * the {@code with...} methods and hand the result back to the repository.
 *
 * @param guildId          owning guild
 * @param channelId        channel the policy applies to
 * @param eventExpectancy  probability (0.0–1.0) that an event fires per
 *                         cooldown window
 * @param eventDuration    length of an event in hours
 * @param eventCooldown    minimum gap between two events in hours
 * @param lastEvent        start of the most recent event in epoch seconds
 * @param maxOffenses      offenses tolerated before a timeout
 * @param timeoutDuration  timeout length in seconds
 * @param prefixes         space- or comma-delimited list of required message
 *                         prefixes
 */
public record ChannelConfig(
        long guildId,
        long channelId,
        double eventExpectancy,
        long eventDuration,
        double eventCooldown,
        long lastEvent,
        long maxOffenses,
        long timeoutDuration,
        String prefixes) {

    /**
     * Builds the policy a caller falls back to when no config has been
     * stored for the channel yet. The result is not persisted.
     */
    public static ChannelConfig defaults(long guildId, long channelId, DefaultsConfig defaults) {
        return new ChannelConfig(guildId, channelId,
                defaults.getEventExpectancy(), defaults.getEventDuration(),
                defaults.getEventCooldown(), 0L, defaults.getMaxOffenses(),
                defaults.getTimeoutDuration(), defaults.getPrefixes());
    }

    /** Returns the individual prefix tokens, see {@link PrefixParser#split}. */
    public List<String> prefixList() {
        return PrefixParser.split(prefixes);
    }

    public ChannelConfig withEventExpectancy(double eventExpectancy) {
        return new ChannelConfig(guildId, channelId, eventExpectancy, eventDuration,
                eventCooldown, lastEvent, maxOffenses, timeoutDuration, prefixes);
    }

    public ChannelConfig withEventDuration(long eventDuration) {
        return new ChannelConfig(guildId, channelId, eventExpectancy, eventDuration,
                eventCooldown, lastEvent, maxOffenses, timeoutDuration, prefixes);
    }

    public ChannelConfig withEventCooldown(double eventCooldown) {
        return new ChannelConfig(guildId, channelId, eventExpectancy, eventDuration,
                eventCooldown, lastEvent, maxOffenses, timeoutDuration, prefixes);
    }

    public ChannelConfig withLastEvent(long lastEvent) {
        return new ChannelConfig(guildId, channelId, eventExpectancy, eventDuration,
                eventCooldown, lastEvent, maxOffenses, timeoutDuration, prefixes);
    }

    public ChannelConfig withMaxOffenses(long maxOffenses) {
        return new ChannelConfig(guildId, channelId, eventExpectancy, eventDuration,
                eventCooldown, lastEvent, maxOffenses, timeoutDuration, prefixes);
    }

    public ChannelConfig withTimeoutDuration(long timeoutDuration) {
        return new ChannelConfig(guildId, channelId, eventExpectancy, eventDuration,
                eventCooldown, lastEvent, maxOffenses, timeoutDuration, prefixes);
    }

    public ChannelConfig withPrefixes(String prefixes) {
        return new ChannelConfig(guildId, channelId, eventExpectancy, eventDuration,
                eventCooldown, lastEvent, maxOffenses, timeoutDuration, prefixes);
    }

    /** Stores the tokens space-separated, the format {@link #prefixList()} reads back. */
    public ChannelConfig withPrefixList(List<String> prefixList) {
        return withPrefixes(String.join(" ", prefixList));
    }
}
