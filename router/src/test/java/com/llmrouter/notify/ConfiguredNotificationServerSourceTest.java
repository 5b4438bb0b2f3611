package com.llmrouter.notify;

import com.llmrouter.config.NotificationProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfiguredNotificationServerSourceTest {

    @Test
    void listsOnlyEnabledServersWithUrl() {
        NotificationProperties properties = new NotificationProperties();
        properties.setServers(List.of(
                server("ops", "http://ops.internal/notify", true),
                server("muted", "http://muted.internal/notify", false),
                server("broken", " ", true),
                server(null, "http://anon.internal/notify", true)));

        List<NotificationServer> servers = new ConfiguredNotificationServerSource(properties).listServers();

        assertEquals(List.of(
                new NotificationServer("ops", "http://ops.internal/notify"),
                new NotificationServer("http://anon.internal/notify", "http://anon.internal/notify")), servers);
    }

    private static NotificationProperties.Server server(String name, String url, boolean enabled) {
        NotificationProperties.Server server = new NotificationProperties.Server();
        server.setName(name);
        server.setUrl(url);
        server.setEnabled(enabled);
        return server;
    }
}
