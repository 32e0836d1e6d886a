/**
 * Multi-provider codebase summarizer.
 *
 * <p>{@link fr.lapetina.codex.summarizer.SummarizerFactory} wires configuration,
 * the provider chain, the request engine and the parallel batch runner.
 */
package fr.lapetina.codex.summarizer;
