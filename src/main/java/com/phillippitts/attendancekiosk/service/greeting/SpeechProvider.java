package com.phillippitts.attendancekiosk.service.greeting;

/**
 * Voice output collaborator. Implementations live outside this project.
 */
public interface SpeechProvider {

    /**
     * Speaks {@code text}. Calls with a key that was already spoken may be ignored.
     *
     * @param key  deduplication key, e.g. an event id
     * @param text phrase to speak
     */
    void speak(String key, String text);
}
