package com.jimin.digest.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine 캐시 설정
 *
 * itemFolders: 아이템 → 소속 폴더 목록 (멤버십 변경 커밋 후 무효화)
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String ITEM_FOLDERS = "itemFolders";

    @Bean
    public CacheManager cacheManager(DigestProperties properties) {
        DigestProperties.CacheSpec spec = properties.getCache().getItemFolders();
        CaffeineCacheManager manager = new CaffeineCacheManager(ITEM_FOLDERS);
        manager.setCaffeine(Caffeine.newBuilder()
                .recordStats()
                .maximumSize(spec.getMaxSize())
                .expireAfterWrite(spec.getTtl()));
        return manager;
    }
}
