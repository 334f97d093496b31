package com.capturebot.webhook.service;

import com.capturebot.common.config.RabbitMQConfig;
import com.capturebot.common.entity.Job;
import com.capturebot.common.message.JobProcessingMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class JobPublisher {

    @Autowired
    private RabbitTemplate rabbitTemplate;

    /**
     * Queue a job for the worker
     */
    public void publish(Job job) {
        JobProcessingMessage message = JobProcessingMessage.from(job);

        rabbitTemplate.convertAndSend(
                RabbitMQConfig.CAPTUREBOT_EXCHANGE,
                RabbitMQConfig.JOB_PROCESS_KEY,
                message
        );

        log.info("Queued {} job for processing: {}", job.getJobType(), job.getId());
    }
}
