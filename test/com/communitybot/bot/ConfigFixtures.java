package com.communitybot.bot;

import com.communitybot.config.BotConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Loads {@code community-bot-test.json}: master 1001, roles slt [1001, 1002], alt [1003], management [1004],
 * internal_affairs [1005], promotions [1004], infractions [1004, 1005]; welcome chat -100200, archive chat
 * -100300, ticket chat -100400, announcement chat -100600, feedback chat -100700; 120 s test cooldown.
 */
final class ConfigFixtures {
    private ConfigFixtures() {}

    static BotConfig load() {
        try (InputStream in = ConfigFixtures.class.getClassLoader().getResourceAsStream("community-bot-test.json")) {
            if (in == null) {
                throw new IllegalStateException("community-bot-test.json missing from the test classpath");
            }
            String json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return BotConfig.fromJson(json, Map.of(BotConfig.TOKEN_ENV, "123:test"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
