package com.gamemaster.resolver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamemaster.models.ResolverEndpointConfig;
import com.gamemaster.providers.chat.ChatProvider;
import com.gamemaster.providers.chat.ChatProviderFactory;

import java.io.IOException;

/**
 * {@link SemanticResolver} backed by a chat-completion provider. The prompt pins the model to
 * answering with a bare choice id or {@code NONE}.
 */
public class ChatSemanticResolver implements SemanticResolver {

    private final ChatProvider provider;
    private final ResolverEndpointConfig endpoint;
    private final String apiKey;
    private final ObjectMapper mapper;

    public ChatSemanticResolver(ChatProviderFactory factory, ResolverEndpointConfig endpoint, String apiKey,
                                ObjectMapper mapper) {
        this.provider = factory.getProvider(endpoint.getProvider());
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.mapper = mapper;
    }

    @Override
    public String resolve(ResolutionRequest request) throws IOException, InterruptedException {
        return provider.complete(apiKey, endpoint, buildPrompt(request));
    }

    String buildPrompt(ResolutionRequest request) throws JsonProcessingException {
        String choices = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(request.getChoiceMap());
        StringBuilder sb = new StringBuilder();
        sb.append("The player is currently in the scene: '").append(request.getSceneTitle()).append("'.\n");
        sb.append("The available choice keys and their descriptions are:\n");
        sb.append(choices).append("\n");
        sb.append("The player's spoken action was: '").append(request.getUtterance()).append("'.\n\n");
        sb.append("Your task is to act as a logic engine. Resolve the player's action to the single best ");
        sb.append("matching choice key from the list.\n");
        sb.append("Do not output any explanation, quotation marks, or extra text.\n");
        sb.append("If the action is ambiguous, irrelevant, or does not clearly map to any choice, output the word '")
            .append(NONE).append("'.\n");
        sb.append("Output ONLY the choice key or '").append(NONE).append("'.");
        return sb.toString();
    }

    public String getProviderName() {
        return provider.getProviderName();
    }
}
