package com.llmrouter.notify;

import java.util.List;

/**
 * Narrow view of whatever delivers push notifications. Only the list of configured target
 * servers crosses this boundary.
 */
public interface NotificationServerSource {

    List<NotificationServer> listServers();
}
