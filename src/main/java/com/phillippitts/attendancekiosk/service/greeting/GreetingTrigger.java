package com.phillippitts.attendancekiosk.service.greeting;

import com.phillippitts.attendancekiosk.domain.DecisionOutcome;
import com.phillippitts.attendancekiosk.service.tracking.event.DecisionEmittedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Greets a person once per stored attendance event.
 *
 * <p>Only RECORDED decisions with a stored event greet; suppressed and unknown ones stay silent.
 * Does nothing when no {@link SpeechProvider} bean exists. Decisions are announced on the frame
 * thread, so speech is handed to the speech executor and this listener returns immediately.
 */
@Component
public class GreetingTrigger {

    private static final Logger LOG = LogManager.getLogger(GreetingTrigger.class);
    private static final int MAX_REMEMBERED = 256;

    private final ObjectProvider<SpeechProvider> speech;
    private final Executor speechExecutor;
    private final Set<String> greeted = Collections.newSetFromMap(new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > MAX_REMEMBERED;
        }
    });

    public GreetingTrigger(ObjectProvider<SpeechProvider> speech,
                           @Qualifier("speechExecutor") Executor speechExecutor) {
        this.speech = speech;
        this.speechExecutor = speechExecutor;
    }

    @EventListener
    public void onDecision(DecisionEmittedEvent e) {
        if (e.outcome() != DecisionOutcome.RECORDED || e.eventId() == null) {
            return;
        }
        SpeechProvider provider = speech.getIfAvailable();
        if (provider == null) {
            return;
        }
        synchronized (greeted) {
            if (!greeted.add(e.eventId())) {
                return;
            }
        }
        try {
            speechExecutor.execute(() -> speak(provider, e));
        } catch (RejectedExecutionException ex) {
            LOG.warn("Greeting for event {} skipped; speech queue full", e.eventId());
        }
    }

    private static void speak(SpeechProvider provider, DecisionEmittedEvent e) {
        try {
            provider.speak(e.eventId(), "Welcome, " + e.personId());
        } catch (RuntimeException ex) {
            LOG.warn("Greeting for event {} failed: {}", e.eventId(), ex.toString());
        }
    }
}
