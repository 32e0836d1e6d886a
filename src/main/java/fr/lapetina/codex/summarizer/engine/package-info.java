/**
 * Request engine: prompt selection, per-provider truncation, retry with
 * backoff, ordered fallback, hierarchical aggregation and usage accounting.
 */
package fr.lapetina.codex.summarizer.engine;
