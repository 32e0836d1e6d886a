package fr.lapetina.codex.summarizer.engine;

/**
 * Per-provider counters as of a snapshot.
 *
 * @param requests successful requests served
 * @param tokens   input plus output tokens of those requests
 * @param errors   failed attempts, retries included
 */
public record ProviderStats(long requests, long tokens, long errors) {

    public static final ProviderStats EMPTY = new ProviderStats(0, 0, 0);
}
