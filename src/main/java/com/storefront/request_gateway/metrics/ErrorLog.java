package com.storefront.request_gateway.metrics;

import com.storefront.request_gateway.accesslog.ErrorEvent;
import com.storefront.request_gateway.config.GatewayProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * The most recent error events, oldest dropped first.
 */
@Component
public class ErrorLog {

    private final int capacity;
    private final Deque<ErrorEvent> events = new ArrayDeque<>();

    @Autowired
    public ErrorLog(GatewayProperties properties) {
        this(properties.getMetrics().getErrorLogCapacity());
    }

    public ErrorLog(int capacity) {
        this.capacity = capacity;
    }

    public synchronized void append(ErrorEvent event) {
        if (events.size() == capacity) {
            events.removeFirst();
        }
        events.addLast(event);
    }

    /** Up to {@code limit} events, newest first. */
    public synchronized List<ErrorEvent> recent(int limit) {
        List<ErrorEvent> result = new ArrayList<>(Math.min(limit, events.size()));
        Iterator<ErrorEvent> newestFirst = events.descendingIterator();
        while (newestFirst.hasNext() && result.size() < limit) {
            result.add(newestFirst.next());
        }
        return result;
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized void clear() {
        events.clear();
    }
}
