package com.waypoint.core.health;

import com.waypoint.core.WaypointException;
import com.waypoint.core.git.GitCommandRunner;
import com.waypoint.core.git.GitResult;
import com.waypoint.core.hooks.GlobalHookStore;
import com.waypoint.core.workunit.WorkUnitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks that the collaborators a transition depends on are usable:
 * the git repository, the work-unit document and the global hook configuration.
 */
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final GitCommandRunner git;
    private final WorkUnitRepository repository;
    private final GlobalHookStore globalHooks;

    public HealthCheckService(GitCommandRunner git, WorkUnitRepository repository, GlobalHookStore globalHooks) {
        this.git = git;
        this.repository = repository;
        this.globalHooks = globalHooks;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGit());
        results.add(checkWorkUnits());
        results.add(checkHooks());
        return results;
    }

    private HealthStatus checkGit() {
        try {
            GitResult result = git.run("rev-parse", "--is-inside-work-tree");
            if (result.ok() && result.stdoutText().trim().equals("true")) {
                return new HealthStatus("git", HealthStatus.Status.UP,
                        "Repository at " + git.getRepositoryRoot(), Map.of());
            }
            return new HealthStatus("git", HealthStatus.Status.DOWN,
                    "Not a git working tree: " + git.getRepositoryRoot(), Map.of());
        } catch (WaypointException e) {
            log.warn("Git health check failed: {}", e.getMessage());
            return new HealthStatus("git", HealthStatus.Status.DOWN,
                    "git unavailable: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkWorkUnits() {
        try {
            int count = repository.findAll().size();
            if (count == 0) {
                return new HealthStatus("work-units", HealthStatus.Status.DEGRADED,
                        "No work units found", Map.of());
            }
            return new HealthStatus("work-units", HealthStatus.Status.UP,
                    count + " work unit(s) loaded", Map.of("count", String.valueOf(count)));
        } catch (WaypointException e) {
            log.warn("Work unit health check failed: {}", e.getMessage());
            return new HealthStatus("work-units", HealthStatus.Status.DOWN, e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkHooks() {
        try {
            int count = globalHooks.all().values().stream().mapToInt(List::size).sum();
            return new HealthStatus("hooks", HealthStatus.Status.UP,
                    count + " global hook(s) configured", Map.of("count", String.valueOf(count)));
        } catch (WaypointException e) {
            log.warn("Hook configuration health check failed: {}", e.getMessage());
            return new HealthStatus("hooks", HealthStatus.Status.DOWN, e.getMessage(), Map.of());
        }
    }
}
