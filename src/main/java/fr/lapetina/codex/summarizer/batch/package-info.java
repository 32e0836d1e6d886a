/**
 * Batch runs: chunking of oversized units, bounded parallel summarization and
 * the master summary.
 */
package fr.lapetina.codex.summarizer.batch;
