package com.waypoint.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "waypoint")
public class WaypointProperties {

    private String projectRoot = ".";
    private WorkUnits workUnits = new WorkUnits();
    private Checkpoints checkpoints = new Checkpoints();
    private Hooks hooks = new Hooks();
    private Temporal temporal = new Temporal();

    public String getProjectRoot() {
        return projectRoot;
    }

    public void setProjectRoot(String projectRoot) {
        this.projectRoot = projectRoot;
    }

    public WorkUnits getWorkUnits() {
        return workUnits;
    }

    public void setWorkUnits(WorkUnits workUnits) {
        this.workUnits = workUnits;
    }

    public Checkpoints getCheckpoints() {
        return checkpoints;
    }

    public void setCheckpoints(Checkpoints checkpoints) {
        this.checkpoints = checkpoints;
    }

    public Hooks getHooks() {
        return hooks;
    }

    public void setHooks(Hooks hooks) {
        this.hooks = hooks;
    }

    public Temporal getTemporal() {
        return temporal;
    }

    public void setTemporal(Temporal temporal) {
        this.temporal = temporal;
    }

    public static class WorkUnits {
        /** Work unit document, relative to the project root. */
        private String file = "spec/work-units.json";

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }
    }

    public static class Checkpoints {
        private String indexDir = ".git/waypoint-checkpoints";
        private String refNamespace = "refs/waypoint-snapshots";

        public String getIndexDir() {
            return indexDir;
        }

        public void setIndexDir(String indexDir) {
            this.indexDir = indexDir;
        }

        public String getRefNamespace() {
            return refNamespace;
        }

        public void setRefNamespace(String refNamespace) {
            this.refNamespace = refNamespace;
        }
    }

    public static class Hooks {
        private String configFile = "spec/waypoint-hooks.json";
        private int defaultTimeoutSeconds = 60;
        private String shell = "sh";

        public String getConfigFile() {
            return configFile;
        }

        public void setConfigFile(String configFile) {
            this.configFile = configFile;
        }

        public int getDefaultTimeoutSeconds() {
            return defaultTimeoutSeconds;
        }

        public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) {
            this.defaultTimeoutSeconds = defaultTimeoutSeconds;
        }

        public String getShell() {
            return shell;
        }

        public void setShell(String shell) {
            this.shell = shell;
        }
    }

    public static class Temporal {
        private String featuresDir = "spec/features";
        private List<String> testRoots = List.of("src/test", "test", "tests", "spec/tests");
        private List<String> ignoreDirs = List.of(".git", "node_modules", "target", "build", "dist", ".idea");

        public String getFeaturesDir() {
            return featuresDir;
        }

        public void setFeaturesDir(String featuresDir) {
            this.featuresDir = featuresDir;
        }

        public List<String> getTestRoots() {
            return testRoots;
        }

        public void setTestRoots(List<String> testRoots) {
            this.testRoots = testRoots;
        }

        public List<String> getIgnoreDirs() {
            return ignoreDirs;
        }

        public void setIgnoreDirs(List<String> ignoreDirs) {
            this.ignoreDirs = ignoreDirs;
        }
    }
}
