package com.fastguard.autoconfig;

import com.fastguard.config.GuardNotifierProperties;
import com.fastguard.core.metric.GuardMetrics;
import com.fastguard.core.notify.AdminNotifier;
import com.fastguard.core.notify.AsyncNotifyingService;
import com.fastguard.core.notify.notifier.KafkaTopicNotifier;
import com.fastguard.core.notify.notifier.LoggingNotifier;
import com.fastguard.core.notify.ratelimit.ThrottleFilter;
import com.fastguard.core.notify.route.ChannelRouter;
import com.fastguard.core.notify.template.DefaultNotifierTemplate;
import com.fastguard.core.spi.PayloadSerializer;
import com.fastguard.core.spi.notify.Notifier;
import com.fastguard.core.spi.notify.NotifierFilter;
import com.fastguard.core.spi.notify.NotifierRouter;
import com.fastguard.core.spi.notify.NotifierTemplate;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@AutoConfiguration(
        after = {GuardMetricsAutoConfiguration.class, FastGuardAutoConfiguration.class},
        afterName = "org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration")
@ConditionalOnProperty(prefix = "guard", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(GuardNotifierProperties.class)
public class GuardNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public NotifierTemplate notifierTemplate() {
        return new DefaultNotifierTemplate();
    }

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier(NotifierTemplate template) {
        return new LoggingNotifier(template);
    }

    @Bean
    @ConditionalOnMissingBean(NotifierRouter.class)
    public NotifierRouter notifierRouter(List<Notifier> notifiers) {
        return new ChannelRouter(notifiers);
    }

    @Bean
    @ConditionalOnMissingBean(NotifierFilter.class)
    public NotifierFilter notifierFilter(GuardNotifierProperties props, Clock clock) {
        return new ThrottleFilter(props.getThrottle().getWindow(), props.getThrottle().getThreshold(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AsyncNotifyingService asyncNotifyingService(NotifierRouter router,
                                                       NotifierFilter filter,
                                                       GuardMetrics metrics,
                                                       GuardNotifierProperties props) {
        GuardNotifierProperties.Async cfg = props.getAsync();
        AtomicInteger seq = new AtomicInteger();
        ThreadPoolExecutor exec = new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "guard-notify-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((th, e) -> LoggerFactory.getLogger("notify").error("uncaught", e));
                    return t;
                },
                // 队列满时拒绝并计数, 不占用业务线程
                new ThreadPoolExecutor.AbortPolicy());
        return new AsyncNotifyingService(exec, router, filter, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public AdminNotifier adminNotifier(AsyncNotifyingService service, GuardNotifierProperties props,
                                       GuardMetrics metrics, Clock clock) {
        return new AdminNotifier(service, props, metrics, clock);
    }

    /**
     * guard.notify.channel=kafka 且容器里有 KafkaTemplate 时追加 kafka 通道
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.kafka.core.KafkaTemplate")
    @ConditionalOnProperty(prefix = "guard.notify", name = "channel", havingValue = "kafka")
    static class KafkaChannelConfiguration {

        @Bean
        @ConditionalOnBean(KafkaTemplate.class)
        @ConditionalOnMissingBean(KafkaTopicNotifier.class)
        public KafkaTopicNotifier kafkaTopicNotifier(KafkaTemplate<String, String> kafkaTemplate,
                                                     PayloadSerializer serializer,
                                                     NotifierTemplate template,
                                                     GuardNotifierProperties props) {
            return new KafkaTopicNotifier(kafkaTemplate, props.getTopic(), serializer, template, props.getSendTimeout());
        }
    }
}
