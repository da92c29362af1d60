package com.delta.jobharvester.harvest.api;

import com.delta.jobharvester.harvest.model.DaemonStatusResponse;
import com.delta.jobharvester.harvest.service.TaskPollingDaemon;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/daemon")
public class DaemonController {
    private final TaskPollingDaemon daemon;

    public DaemonController(TaskPollingDaemon daemon) {
        this.daemon = daemon;
    }

    @PostMapping("/start")
    public DaemonStatusResponse start() {
        daemon.start();
        return daemon.getStatus();
    }

    @PostMapping("/stop")
    public DaemonStatusResponse stop() {
        daemon.stop();
        return daemon.getStatus();
    }

    @GetMapping("/status")
    public DaemonStatusResponse status() {
        return daemon.getStatus();
    }
}
