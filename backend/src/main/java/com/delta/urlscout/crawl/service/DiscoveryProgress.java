package com.delta.urlscout.crawl.service;

import com.delta.urlscout.crawl.frontier.Frontier;
import com.delta.urlscout.crawl.model.DiscoveryState;
import com.delta.urlscout.crawl.phase.DiscoveryBudget;

import java.util.ArrayList;
import java.util.List;

/**
 * Live view of a run for status polling and cancellation. A cancel request made before the run
 * has started is applied as soon as its budget exists.
 */
public class DiscoveryProgress {
    private volatile DiscoveryState state = DiscoveryState.IDLE;
    private volatile String currentPhase;
    private volatile Frontier frontier;
    private DiscoveryBudget budget;
    private boolean cancelRequested;
    private final List<String> completedPhases = new ArrayList<>();

    public DiscoveryState state() {
        return state;
    }

    void state(DiscoveryState newState) {
        this.state = newState;
    }

    public String currentPhase() {
        return currentPhase;
    }

    void startPhase(String phase) {
        this.currentPhase = phase;
    }

    synchronized void finishPhase(String phase) {
        completedPhases.add(phase);
        this.currentPhase = null;
    }

    public synchronized List<String> completedPhases() {
        return List.copyOf(completedPhases);
    }

    synchronized void attach(Frontier runFrontier, DiscoveryBudget runBudget) {
        this.frontier = runFrontier;
        this.budget = runBudget;
        if (cancelRequested) {
            runBudget.cancel();
        }
    }

    public synchronized void cancel() {
        cancelRequested = true;
        if (budget != null) {
            budget.cancel();
        }
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    public int urlsFound() {
        Frontier current = frontier;
        return current == null ? 0 : current.inScopeCount();
    }

    public int pendingUrls() {
        Frontier current = frontier;
        return current == null ? 0 : current.pendingCount();
    }
}
