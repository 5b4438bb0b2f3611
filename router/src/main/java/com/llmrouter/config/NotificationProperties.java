package com.llmrouter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "notifications")
public class NotificationProperties {

    private List<Server> servers = new ArrayList<>();

    @Data
    public static class Server {
        private String name;
        private String url;
        private boolean enabled = true;
    }
}
