package com.healloop.core.autofix;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "healloop.autofix")
public class AutoFixProperties {

    private boolean enabled = true;
    private double confidenceThreshold = 0.85;
    private String backupDir = "backups/auto_fixes";
    /** File names (or workspace-relative paths) that always make a patch high risk. */
    private List<String> criticalFiles = new ArrayList<>(List.of(
            "ExecutionEngine.java", "AutoFixGate.java", "HealloopApplication.java",
            "pom.xml", "application.yml"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public String getBackupDir() {
        return backupDir;
    }

    public void setBackupDir(String backupDir) {
        this.backupDir = backupDir;
    }

    public List<String> getCriticalFiles() {
        return criticalFiles;
    }

    public void setCriticalFiles(List<String> criticalFiles) {
        this.criticalFiles = criticalFiles;
    }
}
