/**
 * Immutable value types shared across the summarizer.
 *
 * <ul>
 *   <li>{@link fr.lapetina.codex.summarizer.domain.model.ModelConfig} - one configured model of the chain</li>
 *   <li>{@link fr.lapetina.codex.summarizer.domain.model.SummaryRequest} - content to summarize</li>
 *   <li>{@link fr.lapetina.codex.summarizer.domain.model.SummaryResponse} - result of a summarize or aggregate call</li>
 *   <li>{@link fr.lapetina.codex.summarizer.domain.model.ProviderType} - supported backend families</li>
 *   <li>{@link fr.lapetina.codex.summarizer.domain.model.ProviderErrorType} - provider failure classification</li>
 * </ul>
 *
 * <p>All records are immutable and safe to share between worker threads.
 */
package fr.lapetina.codex.summarizer.domain.model;
