package com.keystone.core.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.core.config.KeystoneProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} that picks the backing store for every journal.
 * <p>
 * When {@code keystone.store.type=jdbc} (the default) and a {@link DataSource}
 * is available, journals are JDBC tables that survive restarts. Otherwise an
 * in-memory fallback is used -- suitable for development and testing but not
 * durable.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    public JournalFactory journalFactory(KeystoneProperties props,
                                         ObjectProvider<DataSource> dataSource,
                                         ObjectProvider<ObjectMapper> objectMapper) {
        DataSource ds = dataSource.getIfAvailable();
        if ("jdbc".equalsIgnoreCase(props.getStore().getType()) && ds != null) {
            ObjectMapper mapper = objectMapper.getIfAvailable(JdbcJournal::defaultObjectMapper).copy()
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            log.info("Configuring JDBC journals");
            return new JournalFactory() {
                @Override
                public <T> Journal<T> create(String name, Class<T> type) {
                    var journal = new JdbcJournal<>(ds, mapper, name, type);
                    journal.createTable();
                    return journal;
                }
            };
        }
        log.info("Using in-memory journals (governance state will not persist across restarts)");
        return JournalFactory.inMemory();
    }
}
