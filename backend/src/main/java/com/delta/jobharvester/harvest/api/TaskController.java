package com.delta.jobharvester.harvest.api;

import com.delta.jobharvester.harvest.model.ExternalTask;
import com.delta.jobharvester.harvest.model.HarvestOutcome;
import com.delta.jobharvester.harvest.model.HarvestedPostingView;
import com.delta.jobharvester.harvest.model.SearchParams;
import com.delta.jobharvester.harvest.model.TaskKind;
import com.delta.jobharvester.harvest.model.TaskState;
import com.delta.jobharvester.harvest.persistence.ExternalTaskRepository;
import com.delta.jobharvester.harvest.persistence.HarvestedPostingRepository;
import com.delta.jobharvester.harvest.service.TaskOrchestratorService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {
    private final TaskOrchestratorService orchestrator;
    private final ExternalTaskRepository taskRepository;
    private final HarvestedPostingRepository postingRepository;

    public TaskController(
        TaskOrchestratorService orchestrator,
        ExternalTaskRepository taskRepository,
        HarvestedPostingRepository postingRepository
    ) {
        this.orchestrator = orchestrator;
        this.taskRepository = taskRepository;
        this.postingRepository = postingRepository;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ExternalTask submit(@RequestBody TaskSubmitRequest request) {
        TaskKind kind = TaskKind.parse(request.kind());
        if (kind == null) {
            throw new IllegalArgumentException("kind must be one of google_jobs, indeed_jobs");
        }
        SearchParams params = new SearchParams(
            request.searchTerms(),
            request.location(),
            request.limit() == null ? 0 : request.limit(),
            Boolean.TRUE.equals(request.forceFreshClassification())
        );
        return orchestrator.submit(request.owner(), kind, params);
    }

    @GetMapping
    public List<ExternalTask> list(
        @RequestParam(name = "owner", required = false) String owner,
        @RequestParam(name = "state", required = false) List<String> states,
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        List<TaskState> parsed = new ArrayList<>();
        if (states != null) {
            for (String raw : states) {
                TaskState state = TaskState.parse(raw);
                if (state == null) {
                    throw new IllegalArgumentException("unknown task state " + raw);
                }
                parsed.add(state);
            }
        }
        return taskRepository.findTasks(owner, parsed, Math.min(500, Math.max(1, limit)));
    }

    @GetMapping("/{taskId}")
    public ExternalTask get(@PathVariable("taskId") long taskId) {
        return orchestrator.requireTask(taskId);
    }

    @GetMapping("/{taskId}/postings")
    public List<HarvestedPostingView> postings(@PathVariable("taskId") long taskId) {
        orchestrator.requireTask(taskId);
        return postingRepository.findByTask(taskId);
    }

    @PostMapping("/{taskId}/poll")
    public HarvestOutcome poll(@PathVariable("taskId") long taskId) {
        return orchestrator.pollAndProcess(taskId);
    }

    @PostMapping("/sweep-timeouts")
    public Map<String, Integer> sweepTimeouts() {
        return Map.of("timedOut", orchestrator.sweepTimeouts());
    }
}
