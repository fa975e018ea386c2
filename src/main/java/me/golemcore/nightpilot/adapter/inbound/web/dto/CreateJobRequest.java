package me.golemcore.nightpilot.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.nightpilot.domain.model.ExecutionOptions;
import me.golemcore.nightpilot.domain.model.JobSchedule;
import me.golemcore.nightpilot.domain.model.RetryPolicy;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateJobRequest {
    private String id;
    private String name;
    private String prompt;
    private JobSchedule schedule;
    private Integer priority;
    private RetryPolicy retryPolicy;
    private ExecutionOptions executionOptions;
    private List<String> tags;
    private Map<String, String> metadata;
    private boolean paused;
}
