package quest.gekko.searchvolume.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import quest.gekko.searchvolume.service.core.SnapshotDeriver;

@Configuration
public class SnapshotConfig {

    @Bean
    public SnapshotDeriver snapshotDeriver(final SearchVolumeProperties.Snapshot snapshot) {
        return new SnapshotDeriver(snapshot.anchor());
    }

    // only the snapshot job retries, requests fail fast
    @Bean
    public RetryTemplate snapshotRetryTemplate() {
        return RetryTemplate.builder().maxAttempts(3).fixedBackoff(800).build();
    }
}
