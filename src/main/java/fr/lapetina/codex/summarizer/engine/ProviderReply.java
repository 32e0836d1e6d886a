package fr.lapetina.codex.summarizer.engine;

/**
 * Text answered by one provider, with the tokens billed for producing it.
 */
public record ProviderReply(String text, int tokensUsed) {
}
