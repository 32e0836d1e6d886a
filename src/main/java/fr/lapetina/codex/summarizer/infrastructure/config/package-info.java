/**
 * YAML configuration: provider chain, processing, retry, timeouts and metrics.
 */
package fr.lapetina.codex.summarizer.infrastructure.config;
