package com.hyperdesk.vmrequest.config;

import com.hyperdesk.eventstore.EventSerializer;
import com.hyperdesk.eventstore.EventStore;
import com.hyperdesk.eventstore.JdbcEventStore;
import com.hyperdesk.vmrequest.domain.events.VmRequestEventTypes;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/** Event store on the service's DataSource; the schema comes from the Flyway migrations. */
@Configuration(proxyBeanMethods = false)
public class EventStoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventSerializer vmRequestEventSerializer() {
        return new EventSerializer(VmRequestEventTypes.REGISTRY);
    }

    @Bean
    public EventStore eventStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                 EventSerializer serializer, Clock clock) {
        return new JdbcEventStore(jdbcTemplate, transactionTemplate, serializer, clock);
    }
}
