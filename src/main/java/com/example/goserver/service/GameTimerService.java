package com.example.goserver.service;

import com.example.goserver.model.domain.GameSession;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * One-shot timers attached to a session. At most one eviction timer is armed per session.
 */
@Service
public class GameTimerService {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public GameTimerService(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    public void scheduleEviction(GameSession session, Duration grace, Runnable onExpiry) {
        // Re-arming replaces the previous deadline
        cancelEviction(session);
        ScheduledFuture<?> future = taskScheduler.schedule(onExpiry, clock.instant().plus(grace));
        session.setEvictionTimer(future);
    }

    public void cancelEviction(GameSession session) {
        ScheduledFuture<?> timer = session.getEvictionTimer();
        if (timer != null && !timer.isDone()) {
            timer.cancel(false);
        }
        session.setEvictionTimer(null);
    }

    public boolean isEvictionPending(GameSession session) {
        ScheduledFuture<?> timer = session.getEvictionTimer();
        return timer != null && !timer.isDone();
    }
}
