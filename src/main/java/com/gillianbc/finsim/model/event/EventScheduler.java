package com.gillianbc.finsim.model.event;

import com.gillianbc.finsim.exception.ConfigurationException;
import com.gillianbc.finsim.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-trial table of pending events and of temporary mutations waiting to be undone.
 * A fresh scheduler is created for every trial, so firing state never leaks between trials.
 */
@Slf4j
public class EventScheduler {

    private final int startYear;
    private final int duration;
    private final List<LifeEvent> events = new ArrayList<>();
    private final Map<LifeEvent, EventState> states = new IdentityHashMap<>();
    private final Map<LifeEvent, Integer> resolvedYears = new IdentityHashMap<>();
    private final Map<Integer, Deque<Runnable>> restorations = new HashMap<>();

    public EventScheduler(int startYear, int duration) {
        this.startYear = startYear;
        this.duration = duration;
    }

    /**
     * Registers events after checking each resolves to a year inside
     * {@code [startYear, startYear + duration)}.
     */
    public void schedule(List<LifeEvent> toSchedule) {
        int endExclusive = startYear + duration;
        for (LifeEvent event : toSchedule) {
            int year = event.resolveYear(startYear);
            if (year < startYear || year >= endExclusive) {
                throw new ConfigurationException(ErrorCode.EVENT_OUT_OF_RANGE,
                        "event " + event.getName() + " resolves to " + year + ", outside " + startYear
                                + ".." + (endExclusive - 1),
                        Map.of("event", event.getName(), "year", year));
            }
        }
        for (LifeEvent event : toSchedule) {
            events.add(event);
            states.put(event, EventState.UNFIRED);
            resolvedYears.put(event, event.resolveYear(startYear));
        }
    }

    /**
     * Restores temporary mutations that expire this year, then applies every unfired event
     * resolved to {@code year}, in declaration order.
     *
     * @return the events fired
     */
    public List<LifeEvent> fire(int year, ActionTargets targets) {
        Deque<Runnable> expiring = restorations.remove(year);
        if (expiring != null) {
            log.debug("Restoring {} temporary mutation(s) in {}", expiring.size(), year);
            while (!expiring.isEmpty()) {
                expiring.pop().run();
            }
        }

        List<LifeEvent> fired = new ArrayList<>();
        for (LifeEvent event : events) {
            if (states.get(event) != EventState.UNFIRED || resolvedYears.get(event) != year) {
                continue;
            }
            states.put(event, EventState.FIRED);
            log.debug("Firing event {} in {}", event.getName(), year);
            for (Action action : event.getActions()) {
                Runnable restore = action.apply(targets.resolve(action.getTarget(), year), targets.getDebtAccount());
                if (restore != null) {
                    // LIFO so overlapping mutations of one target unwind to the original
                    restorations.computeIfAbsent(year + action.getDuration(), y -> new ArrayDeque<>()).push(restore);
                }
            }
            fired.add(event);
        }
        return Collections.unmodifiableList(fired);
    }

    public EventState stateOf(LifeEvent event) {
        EventState state = states.get(event);
        if (state == null) {
            throw new IllegalArgumentException("event " + event.getName() + " is not scheduled");
        }
        return state;
    }

    public int pendingRestorations() {
        return restorations.values().stream().mapToInt(Deque::size).sum();
    }
}
