package com.example.webhookdispatch.config;

import com.example.webhookdispatch.queue.DeliveryStreamConsumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.stream.StreamMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

/**
 * Redis Stream 配置（多实例部署时的投递队列）。
 */
@Configuration
@Slf4j
@ConditionalOnProperty(name = "app.distribution.mode", havingValue = "redis")
public class RedisStreamConfig {

        public static final String STREAM_KEY = "webhook:deliveries";
        public static final String DELAYED_KEY = "webhook:deliveries:delayed";
        public static final String GROUP_NAME = "webhook-delivery-group";
        public static final String FIELD_DELIVERY_ID = "deliveryId";
        // 动态生成消费者名称，支持多实例部署
        public static final String CONSUMER_NAME = "consumer-" + UUID.randomUUID().toString().substring(0, 8);

        /**
         * 创建并启动流消费监听容器。
         *
         * @param connectionFactory Redis 连接工厂
         * @param consumer          消费者
         * @return 监听容器
         */
        @Bean(destroyMethod = "stop")
        public StreamMessageListenerContainer<String, MapRecord<String, String, String>> deliveryStreamContainer(
                        RedisConnectionFactory connectionFactory,
                        DeliveryStreamConsumer consumer) {

                // 初始化 Stream 与 Group（不存在则创建）
                try (RedisConnection connection = connectionFactory.getConnection()) {
                        connection.streamCommands().xGroupCreate(
                                        STREAM_KEY.getBytes(StandardCharsets.UTF_8), GROUP_NAME, ReadOffset.from("0"), true);
                } catch (Exception e) {
                        log.info("Stream or Group already exists, skipping initialization");
                }

                StreamMessageListenerContainer.StreamMessageListenerContainerOptions<String, MapRecord<String, String, String>> options = StreamMessageListenerContainer.StreamMessageListenerContainerOptions
                                .builder()
                                .pollTimeout(Duration.ofSeconds(1))
                                .build();

                StreamMessageListenerContainer<String, MapRecord<String, String, String>> container = StreamMessageListenerContainer
                                .create(connectionFactory, options);

                container.receive(
                                Consumer.from(GROUP_NAME, CONSUMER_NAME),
                                StreamOffset.create(STREAM_KEY, ReadOffset.lastConsumed()),
                                consumer);

                container.start();
                return container;
        }
}
