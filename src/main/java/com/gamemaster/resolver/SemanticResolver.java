package com.gamemaster.resolver;

import java.io.IOException;

/**
 * External language-model service that maps an utterance onto one of the offered choice ids.
 */
public interface SemanticResolver {

    String NONE = "NONE";

    /**
     * @return the raw reply; expected to be a single choice id or {@link #NONE}
     */
    String resolve(ResolutionRequest request) throws IOException, InterruptedException;
}
