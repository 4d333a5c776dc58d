package com.fastguard.core.notify.notifier;

import com.fastguard.core.spi.PayloadSerializer;
import com.fastguard.core.spi.notify.Notifier;
import com.fastguard.core.spi.notify.NotifierTemplate;
import com.fastguard.model.NotificationEvent;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 把告警事件以 JSON 发到 kafka topic, 由下游值班系统消费
 * 单次发送受 TimeLimiter 限时, 超时按失败处理交给上层重试
 */
public class KafkaTopicNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(KafkaTopicNotifier.class);

    private final KafkaTemplate<String, String> kafkaTemplate;

    private final String topic;

    private final PayloadSerializer serializer;

    private final NotifierTemplate template;

    private final TimeLimiter timeLimiter;

    public KafkaTopicNotifier(KafkaTemplate<String, String> kafkaTemplate, String topic,
                              PayloadSerializer serializer, NotifierTemplate template, Duration sendTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
        this.serializer = serializer;
        this.template = template;
        this.timeLimiter = TimeLimiter.of("notify-kafka:" + topic, TimeLimiterConfig.custom()
                .timeoutDuration(sendTimeout)
                .cancelRunningFuture(true)
                .build());
    }

    @Override
    public String name() {
        return "kafka";
    }

    @Override
    public void notify(NotificationEvent event) throws Exception {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("title", template.renderTitle(event));
        message.put("event", event);
        String payload = serializer.serialize(message);
        String key = event.getErrorType() != null ? event.getErrorType() : String.valueOf(event.getType());

        SendResult<String, String> result =
                timeLimiter.executeFutureSupplier(() -> kafkaTemplate.send(topic, key, payload));
        if (log.isDebugEnabled() && result != null && result.getRecordMetadata() != null) {
            log.debug("[Notify] kafka sent topic={} partition={} offset={}", topic,
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
        }
    }
}
