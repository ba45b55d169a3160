package io.safeagents.core.client;

import com.openai.client.OpenAIClient;
import io.safeagents.core.framework.Framework;
import java.util.Map;

/**
 * Azure chat-completion client in Autogen's shape. Tools are not attached here; Autogen agents
 * receive them directly.
 */
public final class AutogenChatCompletionClient extends AzureChatClient {

  public AutogenChatCompletionClient(Map<String, Object> arguments, OpenAIClient openAIClient) {
    super(Framework.AUTOGEN, arguments, openAIClient);
  }

  public String model() {
    return (String) constructorArguments().get(ClientArguments.MODEL);
  }
}
