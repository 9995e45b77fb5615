package com.delta.propertytracker.crawl.browser;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

public final class UserAgentRotation {
    private UserAgentRotation() {
    }

    public static String pick(List<String> userAgents) {
        if (userAgents == null || userAgents.isEmpty()) {
            throw new IllegalArgumentException("At least one user agent is required");
        }
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }
}
