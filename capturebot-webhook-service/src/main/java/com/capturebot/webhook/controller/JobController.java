package com.capturebot.webhook.controller;

import com.capturebot.common.dto.ApiResponse;
import com.capturebot.common.entity.Job;
import com.capturebot.webhook.service.InboundMessageService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/jobs")
public class JobController {

    @Autowired
    private InboundMessageService inboundMessageService;

    /**
     * Job status lookup
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getJob(
            @PathVariable(name = "jobId") UUID jobId) {

        Job job = inboundMessageService.getJob(jobId);

        // LinkedHashMap: result and error are null for unfinished jobs
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", job.getId().toString());
        data.put("jobType", job.getJobType());
        data.put("status", job.getStatus());
        data.put("result", job.getResult());
        data.put("error", job.getError());
        data.put("createdAt", job.getCreatedAt());
        data.put("updatedAt", job.getUpdatedAt());

        return ResponseEntity.ok(ApiResponse.success(data, "Job retrieved successfully"));
    }
}
