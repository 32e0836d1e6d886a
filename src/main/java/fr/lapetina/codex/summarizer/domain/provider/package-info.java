/**
 * Provider abstraction and the ordered fallback chain.
 *
 * <p>A {@link fr.lapetina.codex.summarizer.domain.provider.ProviderAdapter} wraps one backend behind
 * a single {@code invoke(prompt)} call. The
 * {@link fr.lapetina.codex.summarizer.domain.provider.ProviderChain} is built once per run from the
 * configured models, via the {@link fr.lapetina.codex.summarizer.domain.provider.ProviderFactory}
 * registry, and is read-only afterwards.
 *
 * @see fr.lapetina.codex.summarizer.infrastructure.http
 */
package fr.lapetina.codex.summarizer.domain.provider;
