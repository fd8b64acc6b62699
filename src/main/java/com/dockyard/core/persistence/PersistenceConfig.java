package com.dockyard.core.persistence;

import com.dockyard.core.ports.InMemoryPortStore;
import com.dockyard.core.ports.JdbcPortStore;
import com.dockyard.core.ports.PortStore;
import com.dockyard.core.project.InMemoryProjectStore;
import com.dockyard.core.project.JdbcProjectStore;
import com.dockyard.core.project.ProjectStore;
import com.dockyard.core.queue.InMemoryJobStore;
import com.dockyard.core.queue.JdbcJobStore;
import com.dockyard.core.queue.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Provides the job, project and port stores.
 * <p>
 * When a {@link DataSource} is available (i.e. PostgreSQL is configured), the
 * JDBC stores are used and their tables are created on startup. Otherwise the
 * in-memory stores are used as a fallback, suitable for development and testing
 * but not durable across restarts.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public JobStore jobStore(ObjectProvider<DataSource> dataSource) throws Exception {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory job store (jobs will not persist across restarts)");
            return new InMemoryJobStore();
        }
        log.info("Configuring JDBC job store");
        var store = new JdbcJobStore(ds);
        store.createTables();
        return store;
    }

    @Bean
    public ProjectStore projectStore(ObjectProvider<DataSource> dataSource, Clock clock) throws Exception {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory project store");
            return new InMemoryProjectStore(clock);
        }
        var store = new JdbcProjectStore(ds, clock);
        store.createTables();
        return store;
    }

    @Bean
    public PortStore portStore(ObjectProvider<DataSource> dataSource) throws Exception {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory port store");
            return new InMemoryPortStore();
        }
        var store = new JdbcPortStore(ds);
        store.createTables();
        return store;
    }
}
