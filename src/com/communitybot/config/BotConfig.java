package com.communitybot.config;

import com.communitybot.model.TicketCategory;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bot configuration. Everything but secrets comes from a JSON file
 * ({@code $COMMUNITY_BOT_CONFIG}, or {@code community-bot.json} on the classpath);
 * the token and the uptime URL come from the environment.
 */
public final class BotConfig {
    public static final String CONFIG_ENV = "COMMUNITY_BOT_CONFIG";
    public static final String TOKEN_ENV = "BOT_TOKEN";
    public static final String UPTIME_ENV = "UPTIME_URL";
    private static final String DEFAULT_RESOURCE = "community-bot.json";

    public String botToken;
    public String botUsername;
    public long masterUserId;
    public String triggerPhrase;
    public long welcomeChatId;
    public long archiveChatId;
    public String uptimeUrl; // nullable: pinger disabled

    // role name -> member ids
    public Map<String, Set<Long>> roles = new LinkedHashMap<>();

    public Set<String> protectedRoles = new LinkedHashSet<>();
    public Duration strikeWindow = Duration.ofHours(24);
    public int timeoutBaseMinutes = 5;
    public int timeoutMaxMinutes = 120;

    public Set<String> claimAllRoles = new LinkedHashSet<>();
    public List<TicketCategory> ticketCategories = new ArrayList<>();

    // staff commands
    public Set<String> promotionRoles = new LinkedHashSet<>();
    public Set<String> infractionRoles = new LinkedHashSet<>();
    public long announcementChatId;
    public long feedbackChatId;   // 0: feedback is only acknowledged
    public Duration testCooldown = Duration.ofMinutes(5);

    private BotConfig() {}

    public static BotConfig load() throws IOException {
        String path = System.getenv(CONFIG_ENV);
        String json;
        if (path != null && !path.isBlank()) {
            json = Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } else {
            try (InputStream in = BotConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (in == null) {
                    throw new IOException("No " + CONFIG_ENV + " set and no " + DEFAULT_RESOURCE + " on the classpath");
                }
                json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        BotConfig config = fromJson(json, System.getenv());
        config.validate();
        return config;
    }

    /**
     * Parses a configuration document. Unknown keys are ignored.
     * @throws IllegalStateException if the document is malformed
     */
    public static BotConfig fromJson(String json, Map<String, String> env) {
        BotConfig c = new BotConfig();
        try {
            JSONObject root = new JSONObject(json);
            c.botToken = env.get(TOKEN_ENV);
            String uptime = env.get(UPTIME_ENV);
            c.uptimeUrl = uptime == null || uptime.isBlank() ? null : uptime.trim();

            c.botUsername = root.optString("botUsername", "");
            c.masterUserId = root.optLong("masterUserId", 0L);
            c.triggerPhrase = root.optString("triggerPhrase", "");
            c.welcomeChatId = root.optLong("welcomeChatId", 0L);
            c.archiveChatId = root.optLong("archiveChatId", 0L);

            JSONObject roles = root.optJSONObject("roles");
            if (roles != null) {
                for (String role : roles.keySet()) {
                    Set<Long> ids = new LinkedHashSet<>();
                    JSONArray arr = roles.getJSONArray(role);
                    for (int i = 0; i < arr.length(); i++) {
                        ids.add(arr.getLong(i));
                    }
                    c.roles.put(role, ids);
                }
            }

            JSONObject antiPing = root.optJSONObject("antiPing");
            if (antiPing != null) {
                c.protectedRoles.addAll(strings(antiPing.optJSONArray("protectedRoles")));
                c.strikeWindow = Duration.ofHours(antiPing.optLong("windowHours", 24));
                c.timeoutBaseMinutes = antiPing.optInt("baseMinutes", 5);
                c.timeoutMaxMinutes = antiPing.optInt("maxMinutes", 120);
            } else {
                c.protectedRoles.add("slt");
                c.protectedRoles.add("alt");
            }

            JSONObject tickets = root.optJSONObject("tickets");
            if (tickets != null) {
                c.claimAllRoles.addAll(strings(tickets.optJSONArray("claimAllRoles")));
                JSONArray categories = tickets.optJSONArray("categories");
                Set<String> keys = new LinkedHashSet<>();
                for (int i = 0; categories != null && i < categories.length(); i++) {
                    JSONObject cat = categories.getJSONObject(i);
                    String key = cat.getString("key").trim();
                    if (key.isEmpty() || !keys.add(key)) {
                        throw new IllegalStateException("Ticket category key '" + key + "' is empty or repeated");
                    }
                    c.ticketCategories.add(new TicketCategory(
                            key,
                            cat.optString("label", key),
                            cat.optString("description", ""),
                            cat.optLong("chatId", 0L),
                            new LinkedHashSet<>(strings(cat.optJSONArray("extraClaimRoles")))));
                }
            }

            JSONObject staff = root.optJSONObject("staff");
            if (staff != null) {
                c.promotionRoles.addAll(strings(staff.optJSONArray("promotionRoles")));
                c.infractionRoles.addAll(strings(staff.optJSONArray("infractionRoles")));
                c.announcementChatId = staff.optLong("announcementChatId", 0L);
                c.feedbackChatId = staff.optLong("feedbackChatId", 0L);
                c.testCooldown = Duration.ofSeconds(staff.optLong("testCooldownSeconds", 300));
            }
        } catch (JSONException e) {
            throw new IllegalStateException("Invalid bot configuration: " + e.getMessage(), e);
        }
        c.roles = Collections.unmodifiableMap(c.roles);
        c.ticketCategories = Collections.unmodifiableList(c.ticketCategories);
        return c;
    }

    /**
     * Checks the values the bot cannot start without.
     */
    public void validate() {
        if (botToken == null || botToken.isBlank()) {
            throw new IllegalStateException(TOKEN_ENV + " environment variable is not set");
        }
        if (botUsername == null || botUsername.isBlank()) {
            throw new IllegalStateException("botUsername is missing from the configuration");
        }
        if (timeoutBaseMinutes < 1 || timeoutMaxMinutes < timeoutBaseMinutes) {
            throw new IllegalStateException("antiPing minutes must satisfy 1 <= baseMinutes <= maxMinutes");
        }
        if (strikeWindow.isZero() || strikeWindow.isNegative()) {
            throw new IllegalStateException("antiPing.windowHours must be positive");
        }
        if (testCooldown.isNegative()) {
            throw new IllegalStateException("staff.testCooldownSeconds must not be negative");
        }
    }

    private static List<String> strings(JSONArray arr) {
        List<String> out = new ArrayList<>();
        for (int i = 0; arr != null && i < arr.length(); i++) {
            out.add(arr.getString(i));
        }
        return out;
    }
}
