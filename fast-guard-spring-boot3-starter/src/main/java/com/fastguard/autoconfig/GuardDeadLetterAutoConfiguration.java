package com.fastguard.autoconfig;

import com.fastguard.config.GuardDeadLetterProperties;
import com.fastguard.core.dlq.DeadLetterQueue;
import com.fastguard.core.dlq.store.LocalFileDeadLetterStore;
import com.fastguard.core.dlq.store.MybatisDeadLetterStore;
import com.fastguard.core.metric.GuardMetrics;
import com.fastguard.core.notify.AdminNotifier;
import com.fastguard.core.spi.PayloadSerializer;
import com.fastguard.core.spi.dlq.DeadLetterStore;
import com.fastguard.mapper.DeadLetterMapper;
import com.fastguard.model.enums.DeadLetterBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Paths;
import java.time.Clock;

@AutoConfiguration(after = {GuardMybatisAutoConfiguration.class, GuardTxAutoConfiguration.class,
        GuardNotifierAutoConfiguration.class})
@ConditionalOnProperty(prefix = "guard", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(GuardDeadLetterProperties.class)
public class GuardDeadLetterAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GuardDeadLetterAutoConfiguration.class);

    /**
     * 未配置数据库后端（或其依赖缺失）时落本地文件
     */
    @Bean
    @ConditionalOnMissingBean(DeadLetterStore.class)
    public DeadLetterStore localFileDeadLetterStore(GuardDeadLetterProperties props, PayloadSerializer serializer) {
        if (props.getBackend() == DeadLetterBackend.DATABASE) {
            log.warn("[DLQ] backend=database but no DeadLetterMapper/TransactionTemplate available, "
                    + "falling back to local file {}", props.getLocalFilePath());
        }
        return new LocalFileDeadLetterStore(Paths.get(props.getLocalFilePath()), serializer);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterQueue deadLetterQueue(DeadLetterStore store, PayloadSerializer serializer,
                                           GuardDeadLetterProperties props, GuardMetrics metrics,
                                           ObjectProvider<AdminNotifier> notifier, Clock clock) {
        return new DeadLetterQueue(store, serializer, props, metrics, notifier.getIfAvailable(), clock);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "com.baomidou.mybatisplus.core.mapper.BaseMapper")
    @ConditionalOnProperty(prefix = "guard.dlq", name = "backend", havingValue = "database")
    static class DatabaseStoreConfiguration {

        @Bean
        @ConditionalOnBean({DeadLetterMapper.class, TransactionTemplate.class})
        @ConditionalOnMissingBean(DeadLetterStore.class)
        public DeadLetterStore mybatisDeadLetterStore(DeadLetterMapper mapper, TransactionTemplate tt,
                                                      PayloadSerializer serializer) {
            return new MybatisDeadLetterStore(mapper, tt, serializer);
        }
    }
}
