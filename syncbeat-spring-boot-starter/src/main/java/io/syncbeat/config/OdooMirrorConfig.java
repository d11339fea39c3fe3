package io.syncbeat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.syncbeat.mirror.ReconciliationEngine;
import io.syncbeat.odoo.OdooClient;
import io.syncbeat.odoo.OdooProperties;
import io.syncbeat.odoo.jdbc.JdbcContactStore;
import io.syncbeat.odoo.jdbc.JdbcInvoiceStore;
import io.syncbeat.odoo.jobs.SyncContactsJob;
import io.syncbeat.odoo.jobs.SyncInvoicesJob;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnSingleCandidate;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.Objects;

/**
 * Wires the Odoo client, the local mirror and the two sync jobs.
 * Active once {@code syncbeat.odoo.url} is set and a {@link JdbcTemplate} is available.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration",
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration"
})
@ConditionalOnClass({OdooClient.class, JdbcTemplate.class, RestClient.class})
@ConditionalOnSingleCandidate(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "syncbeat.odoo", name = "url")
@EnableConfigurationProperties({OdooProperties.class, MirrorProperties.class})
public class OdooMirrorConfig {

    @Bean
    @ConditionalOnMissingBean
    public OdooClient odooClient(OdooProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) props.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) props.getReadTimeout().toMillis());
        RestClient restClient = RestClient.builder()
                .baseUrl(props.getUrl())
                .requestFactory(requestFactory)
                .build();
        return new OdooClient(restClient, objectMapper.getIfAvailable(ObjectMapper::new), props);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReconciliationEngine reconciliationEngine(JdbcTemplate jdbcTemplate,
                                                     ObjectProvider<PlatformTransactionManager> transactionManager,
                                                     ObjectProvider<Clock> clock,
                                                     MirrorProperties mirrorProps) {
        PlatformTransactionManager tm = transactionManager.getIfUnique(
                () -> new DataSourceTransactionManager(Objects.requireNonNull(jdbcTemplate.getDataSource())));
        return new ReconciliationEngine(new TransactionTemplate(tm), mirrorProps.isAllowEmptySnapshot(),
                clock.getIfUnique(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcContactStore jdbcContactStore(JdbcTemplate jdbcTemplate) {
        return new JdbcContactStore(new NamedParameterJdbcTemplate(jdbcTemplate));
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcInvoiceStore jdbcInvoiceStore(JdbcTemplate jdbcTemplate) {
        return new JdbcInvoiceStore(new NamedParameterJdbcTemplate(jdbcTemplate));
    }

    @Bean
    @ConditionalOnMissingBean
    public SyncContactsJob syncContactsJob(OdooClient client, ReconciliationEngine engine, JdbcContactStore store) {
        return new SyncContactsJob(client, engine, store);
    }

    @Bean
    @ConditionalOnMissingBean
    public SyncInvoicesJob syncInvoicesJob(OdooClient client, ReconciliationEngine engine, JdbcInvoiceStore store) {
        return new SyncInvoicesJob(client, engine, store);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MirrorSchemaInitializer mirrorSchemaInitializer(JdbcTemplate jdbcTemplate) {
        return new MirrorSchemaInitializer(Objects.requireNonNull(jdbcTemplate.getDataSource()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "syncbeat.mirror", name = "initialize-schema", havingValue = "true")
    public SmartInitializingSingleton mirrorSchemaInitializerRunner(MirrorSchemaInitializer initializer) {
        return initializer::initialize;
    }
}
