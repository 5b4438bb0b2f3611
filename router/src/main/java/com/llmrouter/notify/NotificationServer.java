package com.llmrouter.notify;

public record NotificationServer(String name, String url) {
}
