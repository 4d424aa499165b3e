package com.portfolioradar.config;

import com.portfolioradar.common.AssetLocks;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared per-asset lock registry for holdings projection.
 */
@Configuration
public class LockConfig {

    @Bean
    public AssetLocks assetLocks() {
        return new AssetLocks();
    }
}
