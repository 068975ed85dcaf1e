package com.chatpulse.server.mq;

import com.chatpulse.server.event.RelayEventPublisher;
import com.chatpulse.server.http.IngestRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Feeds relay events published on RabbitMQ into the {@link RelayEventPublisher}.
 * Routing key {@code relay.<kind>} selects the operation; the body is an {@link IngestRequest} as JSON.
 */
@Component
@ConditionalOnProperty(name = "mq.enabled", havingValue = "true")
public class MqEventListener {
    private static final Logger log = LoggerFactory.getLogger(MqEventListener.class);

    static final String ROUTING_PREFIX = "relay.";

    @Value("${spring.rabbitmq.host:localhost}")
    private String host;

    @Value("${spring.rabbitmq.port:5672}")
    private int port;

    @Value("${spring.rabbitmq.username:guest}")
    private String username;

    @Value("${spring.rabbitmq.password:guest}")
    private String password;

    @Value("${mq.exchange:relay.exchange}")
    private String exchange;

    @Value("${mq.queue:relay.events}")
    private String queue;

    @Value("${mq.prefetch:256}")
    private int prefetch;

    private final RelayEventPublisher publisher;
    private final ObjectMapper mapper;

    private Connection connection;
    private Channel channel;

    public MqEventListener(RelayEventPublisher publisher, ObjectMapper mapper) {
        this.publisher = publisher;
        this.mapper = mapper;
    }

    @PostConstruct
    public void init() throws Exception {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(host);
        factory.setPort(port);
        factory.setUsername(username);
        factory.setPassword(password);
        factory.setAutomaticRecoveryEnabled(true);
        factory.setNetworkRecoveryInterval(3000);

        this.connection = factory.newConnection("chatpulse-relay");
        this.channel = connection.createChannel();
        channel.basicQos(prefetch);
        channel.exchangeDeclare(exchange, BuiltinExchangeType.TOPIC, true);
        channel.queueDeclare(queue, true, false, false, null);
        channel.queueBind(queue, exchange, ROUTING_PREFIX + "#");

        // single consumer per channel keeps per-room publish order
        channel.basicConsume(queue, false, new DefaultConsumer(channel) {
            @Override
            public void handleDelivery(String consumerTag, Envelope env,
                                       AMQP.BasicProperties props, byte[] body) throws IOException {
                onDelivery(getChannel(), env, body);
            }
        });
        log.info("[BOOT] MQ listener connected to {}:{} exchange={} queue={}", host, port, exchange, queue);
    }

    @PreDestroy
    public void close() {
        try {
            if (channel != null && channel.isOpen()) channel.close();
        } catch (Exception e) {
            log.warn("[MQ] channel close failed: {}", e.getMessage());
        }
        try {
            if (connection != null && connection.isOpen()) connection.close();
        } catch (Exception e) {
            log.warn("[MQ] connection close failed: {}", e.getMessage());
        }
        log.info("[MQ] Closed channel and connection");
    }

    /** Acks a delivery that was routed, nacks without requeue anything else. Never throws on a bad body. */
    void onDelivery(Channel ch, Envelope env, byte[] body) throws IOException {
        long tag = env.getDeliveryTag();
        IngestRequest req;
        try {
            req = mapper.readValue(body, IngestRequest.class);
        } catch (IOException e) {
            log.warn("[MQ] invalid json key={} tag={}: {}", env.getRoutingKey(), tag, e.getMessage());
            ch.basicNack(tag, false, false);
            return;
        }
        if (req == null) {
            log.warn("[MQ] empty body key={} tag={}", env.getRoutingKey(), tag);
            ch.basicNack(tag, false, false);
            return;
        }
        boolean routed;
        try {
            routed = route(env.getRoutingKey(), req);
        } catch (RuntimeException e) {
            log.error("[MQ] route failed key={} tag={}", env.getRoutingKey(), tag, e);
            routed = false;
        }
        if (!routed) {
            ch.basicNack(tag, false, false);
            return;
        }
        ch.basicAck(tag, false);
    }

    /**
     * @return false if the routing key or body does not describe a relay event
     */
    boolean route(String routingKey, IngestRequest req) {
        if (routingKey == null || !routingKey.startsWith(ROUTING_PREFIX)) {
            log.warn("[MQ] unexpected routing key {}", routingKey);
            return false;
        }
        String kind = routingKey.substring(ROUTING_PREFIX.length());
        switch (kind) {
            case "message":
                publisher.publishMessage(req.channel, req.data);
                return true;
            case "message_deleted":
                publisher.publishMessageDeleted(req.channel, req.data);
                return true;
            case "mod_action":
                publisher.publishModAction(req.channel, req.data);
                return true;
            case "global":
                if (req.event == null || req.event.isBlank()) break;
                publisher.publishGlobal(req.event, req.data);
                return true;
            case "all":
                if (req.event == null || req.event.isBlank()) break;
                publisher.publishToAll(req.event, req.data);
                return true;
            default:
                break;
        }
        log.warn("[MQ] dropped key={} event={}", routingKey, req.event);
        return false;
    }
}
