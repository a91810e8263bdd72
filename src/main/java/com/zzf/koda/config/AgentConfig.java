package com.zzf.koda.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "koda.agent")
public class AgentConfig {
    private int maxIterations = 25;
    private long phaseTimeoutMs = 300_000L;
    private int maxValidationAttempts = 3;
    private long commandTimeoutMs = 30_000L;
    private long maxCommandTimeoutMs = 300_000L;
    private int maxObservationChars = 12_000;
    private int maxEventResultChars = 2_000;
    private int maxReadLines = 2_000;
    private int maxSearchMatches = 100;
    private int maxSymbols = 200;
    private int retainedTasks = 100;
    private long approvalTtlMs = 86_400_000L;
    private String workspaceDir = System.getProperty("user.home") + "/.koda/workspaces";
    private String repoRoot = System.getProperty("user.dir");
    private String defaultBranch = "main";
    private boolean summaryCacheEnabled = true;
    private String summaryCacheDir = System.getProperty("user.home") + "/.koda/cache";

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public long getPhaseTimeoutMs() {
        return phaseTimeoutMs;
    }

    public void setPhaseTimeoutMs(long phaseTimeoutMs) {
        this.phaseTimeoutMs = phaseTimeoutMs;
    }

    public int getMaxValidationAttempts() {
        return maxValidationAttempts;
    }

    public void setMaxValidationAttempts(int maxValidationAttempts) {
        this.maxValidationAttempts = maxValidationAttempts;
    }

    public long getCommandTimeoutMs() {
        return commandTimeoutMs;
    }

    public void setCommandTimeoutMs(long commandTimeoutMs) {
        this.commandTimeoutMs = commandTimeoutMs;
    }

    public long getMaxCommandTimeoutMs() {
        return maxCommandTimeoutMs;
    }

    public void setMaxCommandTimeoutMs(long maxCommandTimeoutMs) {
        this.maxCommandTimeoutMs = maxCommandTimeoutMs;
    }

    public int getMaxObservationChars() {
        return maxObservationChars;
    }

    public void setMaxObservationChars(int maxObservationChars) {
        this.maxObservationChars = maxObservationChars;
    }

    public int getMaxEventResultChars() {
        return maxEventResultChars;
    }

    public void setMaxEventResultChars(int maxEventResultChars) {
        this.maxEventResultChars = maxEventResultChars;
    }

    public int getMaxReadLines() {
        return maxReadLines;
    }

    public void setMaxReadLines(int maxReadLines) {
        this.maxReadLines = maxReadLines;
    }

    public int getMaxSearchMatches() {
        return maxSearchMatches;
    }

    public void setMaxSearchMatches(int maxSearchMatches) {
        this.maxSearchMatches = maxSearchMatches;
    }

    public int getMaxSymbols() {
        return maxSymbols;
    }

    public void setMaxSymbols(int maxSymbols) {
        this.maxSymbols = maxSymbols;
    }

    public int getRetainedTasks() {
        return retainedTasks;
    }

    public void setRetainedTasks(int retainedTasks) {
        this.retainedTasks = retainedTasks;
    }

    public long getApprovalTtlMs() {
        return approvalTtlMs;
    }

    public void setApprovalTtlMs(long approvalTtlMs) {
        this.approvalTtlMs = approvalTtlMs;
    }

    public String getWorkspaceDir() {
        return workspaceDir;
    }

    public void setWorkspaceDir(String workspaceDir) {
        this.workspaceDir = workspaceDir;
    }

    public String getRepoRoot() {
        return repoRoot;
    }

    public void setRepoRoot(String repoRoot) {
        this.repoRoot = repoRoot;
    }

    public String getDefaultBranch() {
        return defaultBranch;
    }

    public void setDefaultBranch(String defaultBranch) {
        this.defaultBranch = defaultBranch;
    }

    public boolean isSummaryCacheEnabled() {
        return summaryCacheEnabled;
    }

    public void setSummaryCacheEnabled(boolean summaryCacheEnabled) {
        this.summaryCacheEnabled = summaryCacheEnabled;
    }

    public String getSummaryCacheDir() {
        return summaryCacheDir;
    }

    public void setSummaryCacheDir(String summaryCacheDir) {
        this.summaryCacheDir = summaryCacheDir;
    }
}
