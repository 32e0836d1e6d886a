package fr.lapetina.codex.summarizer.engine;

import java.time.Duration;

/**
 * Blocking pause between retry attempts. Replaced in tests to skip real delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
