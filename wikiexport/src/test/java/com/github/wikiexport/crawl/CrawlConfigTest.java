package com.github.wikiexport.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.Test;

public class CrawlConfigTest {
    @Test
    public void shouldHaveDefaults() {
        var config = new CrawlConfig();

        assertThat(config.includesHistory()).isFalse();
        assertThat(config.optSaveDir()).isEmpty();
        assertThat(config.optLimit()).isEmpty();
        assertThat(config.getWorkerCount()).isEqualTo(CrawlConfig.DEFAULT_WORKERS);
        assertThat(config.getBatchSize()).isEqualTo(300);
        assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    public void shouldBoundWorkersByLimit() {
        var config = new CrawlConfig().limit(3);

        assertThat(config.optLimit()).hasValue(3);
        assertThat(config.getWorkerCount()).isEqualTo(3);
    }

    @Test
    public void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new CrawlConfig().limit(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CrawlConfig().batchSize(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CrawlConfig().requestTimeout(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}
