package com.capturebot.common.config;

import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableRabbit
public class RabbitMQConfig {

    // Queue names
    public static final String CAPTURE_JOBS_QUEUE = "capture.jobs";
    public static final String CAPTURE_JOBS_DLQ = "capture.jobs.dlq";

    // Exchange names
    public static final String CAPTUREBOT_EXCHANGE = "capturebot.exchange";
    public static final String CAPTUREBOT_DLX = "capturebot.dlx";

    // Routing keys
    public static final String JOB_PROCESS_KEY = "job.process";

    @Bean
    public DirectExchange captureBotExchange() {
        return new DirectExchange(CAPTUREBOT_EXCHANGE, true, false);
    }

    @Bean
    public DirectExchange captureBotDeadLetterExchange() {
        return new DirectExchange(CAPTUREBOT_DLX, true, false);
    }

    /**
     * One message per job id; each is consumed by exactly one worker.
     */
    @Bean
    public Queue captureJobsQueue() {
        return QueueBuilder.durable(CAPTURE_JOBS_QUEUE)
                .withArgument("x-dead-letter-exchange", CAPTUREBOT_DLX)
                .withArgument("x-dead-letter-routing-key", JOB_PROCESS_KEY)
                .build();
    }

    @Bean
    public Queue captureJobsDeadLetterQueue() {
        return QueueBuilder.durable(CAPTURE_JOBS_DLQ).build();
    }

    @Bean
    public Binding captureJobsBinding() {
        return BindingBuilder
                .bind(captureJobsQueue())
                .to(captureBotExchange())
                .with(JOB_PROCESS_KEY);
    }

    @Bean
    public Binding captureJobsDeadLetterBinding() {
        return BindingBuilder
                .bind(captureJobsDeadLetterQueue())
                .to(captureBotDeadLetterExchange())
                .with(JOB_PROCESS_KEY);
    }

    @Bean
    public Jackson2JsonMessageConverter messageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(messageConverter());
        return template;
    }
}
