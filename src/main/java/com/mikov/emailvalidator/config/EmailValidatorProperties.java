package com.mikov.emailvalidator.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code emailvalidator.*} namespace.
 *
 * @author zahari.mikov
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "emailvalidator")
public class EmailValidatorProperties {

    private Format format = new Format();
    private Lists lists = new Lists();
    private Mx mx = new Mx();
    private Dns dns = new Dns();

    @Getter
    @Setter
    public static class Format {
        /**
         * Top-level domains accepted in addition to the IANA list built into Commons Validator.
         */
        private List<String> allowedTlds = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Lists {
        private String blocklistLocation = "classpath:data/blocklist.conf";
        private String allowlistLocation = "classpath:data/allowlist.conf";
        private boolean loadDefaults = true;
        private List<String> extraBlocked = new ArrayList<>();
        private List<String> extraAllowed = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Mx {
        private boolean cacheEnabled = true;
    }

    @Getter
    @Setter
    public static class Dns {
        /**
         * Resolver addresses; empty means the system resolvers.
         */
        private List<String> servers = new ArrayList<>();
        private Duration timeout = Duration.ofSeconds(3);
    }
}
