package com.fw24.framework.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;

@ConfigMapping(prefix = "fw24.entity")
public interface EntityCrudConfig {

    Unique unique();

    Audit audit();

    Events events();

    Search search();

    interface Unique {
        /** Numbered candidates tried before falling back to a random suffix. */
        @WithName("max-attempts")
        @WithDefault("5")
        int maxAttempts();
    }

    interface Audit {
        @WithDefault("true")
        boolean enabled();
    }

    interface Events {
        @WithName("await-async-timeout")
        @WithDefault("PT30S")
        Duration awaitAsyncTimeout();
    }

    interface Search {
        @WithName("keyword-delimiters")
        @WithDefault("[&,+ ]+")
        String keywordDelimiters();
    }
}
