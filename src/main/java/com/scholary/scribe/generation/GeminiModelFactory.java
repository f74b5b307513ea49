package com.scholary.scribe.generation;

import com.google.genai.Client;
import com.google.genai.types.CountTokensResponse;
import com.google.genai.types.GenerateContentResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link GenerativeModelFactory} backed by the Google Gen AI SDK (Gemini Developer API).
 *
 * <p>The SDK client is created lazily on the first bind and shared by all bound models. Without
 * an API key the factory reports itself unconfigured and never creates a client.
 */
public class GeminiModelFactory implements GenerativeModelFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiModelFactory.class);

  private final String apiKey;
  private Client client;

  public GeminiModelFactory(String apiKey) {
    this.apiKey = apiKey;
  }

  @Override
  public boolean isConfigured() {
    return apiKey != null && !apiKey.isBlank();
  }

  @Override
  public GenerativeModel bind(String modelId) {
    if (!isConfigured()) {
      throw new IllegalStateException("Gemini API key is not configured");
    }
    return new GeminiModel(client(), modelId);
  }

  private synchronized Client client() {
    if (client == null) {
      client = Client.builder().apiKey(apiKey).build();
      LOGGER.info("Initialized Gemini client");
    }
    return client;
  }

  private static final class GeminiModel implements GenerativeModel {

    private final Client client;
    private final String modelId;

    private GeminiModel(Client client, String modelId) {
      this.client = client;
      this.modelId = modelId;
    }

    @Override
    public int countTokens(String text) {
      CountTokensResponse response = client.models.countTokens(modelId, text, null);
      return response.totalTokens().orElse(0);
    }

    @Override
    public String generateContent(String prompt) {
      GenerateContentResponse response = client.models.generateContent(modelId, prompt, null);
      return response.text();
    }
  }
}
