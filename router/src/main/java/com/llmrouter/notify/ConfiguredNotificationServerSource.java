package com.llmrouter.notify;

import com.llmrouter.config.NotificationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class ConfiguredNotificationServerSource implements NotificationServerSource {

    private final NotificationProperties properties;

    @Override
    public List<NotificationServer> listServers() {
        return properties.getServers().stream()
                .filter(NotificationProperties.Server::isEnabled)
                .filter(server -> server.getUrl() != null && !server.getUrl().isBlank())
                .map(server -> new NotificationServer(
                        server.getName() != null ? server.getName() : server.getUrl(), server.getUrl()))
                .collect(Collectors.toList());
    }
}
