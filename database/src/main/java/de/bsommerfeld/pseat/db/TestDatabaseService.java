package de.bsommerfeld.pseat.db;

import com.google.inject.Singleton;
import de.bsommerfeld.pseat.core.domain.ChannelConfig;
import de.bsommerfeld.pseat.core.domain.UserOffenses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link DatabaseService} for TEST mode: no disk I/O, no SQLite,
 * no schema. Bound by {@link RulesModule} when the application runs with
 * {@code app.mode=TEST}.
 *
 * <p>
 * Keeps the same contract as {@link SqlDatabaseService}: one value per
 * composite key, whole-value replacement on write, empty results for unknown
 * keys. Everything is lost when the process exits.
 */
@Singleton
public class TestDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(TestDatabaseService.class);

    private final Map<ChannelKey, ChannelConfig> configStore = new ConcurrentHashMap<>();
    private final Map<UserKey, UserOffenses> userStore = new ConcurrentHashMap<>();

    public TestDatabaseService() {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Database persistence is DISABLED #");
        LOG.warn("#######################################################");
    }

    @Override
    public Optional<ChannelConfig> getConfig(long guildId, long channelId) {
        return Optional.ofNullable(configStore.get(new ChannelKey(guildId, channelId)));
    }

    @Override
    public void putConfig(ChannelConfig config) {
        configStore.put(ChannelKey.of(config), config);
    }

    @Override
    public Optional<UserOffenses> getUser(long guildId, long channelId, long userId) {
        return Optional.ofNullable(userStore.get(new UserKey(guildId, channelId, userId)));
    }

    @Override
    public void putUser(UserOffenses user) {
        userStore.put(UserKey.of(user), user);
    }

    @Override
    public List<UserOffenses> listUsers(long guildId, long channelId) {
        ChannelKey channel = new ChannelKey(guildId, channelId);
        List<UserOffenses> result = new ArrayList<>();
        for (Map.Entry<UserKey, UserOffenses> entry : userStore.entrySet()) {
            if (entry.getKey().channel().equals(channel))
                result.add(entry.getValue());
        }
        return result;
    }

    @Override
    public int countConfigs() {
        return configStore.size();
    }

    @Override
    public int countUsers() {
        return userStore.size();
    }
}
