package quest.gekko.searchvolume.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import quest.gekko.searchvolume.repository.JpaSearchVolumeStore;

/**
 * Keyword names rarely change, so the store's lookups are served from Caffeine.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    @Bean
    public CacheManager cacheManager(final SearchVolumeProperties.Cache properties) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.registerCustomCache(JpaSearchVolumeStore.KEYWORD_NAMES_CACHE, Caffeine.newBuilder()
                .maximumSize(properties.keywordNamesMaxSize())
                .expireAfterWrite(properties.keywordNamesTtl())
                .recordStats()
                .build());
        return cacheManager;
    }
}
