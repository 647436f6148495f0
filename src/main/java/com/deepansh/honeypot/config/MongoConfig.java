package com.deepansh.honeypot.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * One repository package per store. Timestamps are set explicitly from the
 * injected {@link java.time.Clock}, so auditing is not enabled.
 */
@Configuration
@EnableMongoRepositories(basePackages = {
    "com.deepansh.honeypot.session",
    "com.deepansh.honeypot.archive",
    "com.deepansh.honeypot.intel"
})
public class MongoConfig {
}
