package io.safeagents.core.client;

import com.openai.client.OpenAIClient;
import com.openai.core.JsonValue;
import com.openai.models.FunctionDefinition;
import com.openai.models.FunctionParameters;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionFunctionTool;
import com.openai.models.chat.completions.ChatCompletionTool;
import io.safeagents.core.framework.Framework;
import io.safeagents.core.model.Tool;
import io.safeagents.core.model.ToolDefinition;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Azure chat client in LangGraph's shape. Unlike the other frameworks, LangGraph expects tools to
 * be bound onto the chat model itself: {@link #bindTools(List, boolean)} returns a new handle that
 * offers exactly the given tools and shares the underlying SDK client with this one.
 */
public final class LangGraphChatClient extends AzureChatClient {
  private final List<Tool> boundTools;
  private final boolean parallelToolCalls;

  public LangGraphChatClient(Map<String, Object> arguments, OpenAIClient openAIClient) {
    this(arguments, openAIClient, List.of(), true);
  }

  private LangGraphChatClient(
      Map<String, Object> arguments,
      OpenAIClient openAIClient,
      List<Tool> boundTools,
      boolean parallelToolCalls) {
    super(Framework.LANGGRAPH, arguments, openAIClient);
    this.boundTools = boundTools;
    this.parallelToolCalls = parallelToolCalls;
  }

  public String name() {
    return (String) constructorArguments().get(ClientArguments.NAME);
  }

  /**
   * Returns a copy of this client offering exactly {@code tools}. Previously bound tools are
   * replaced, not merged. This instance is left untouched.
   */
  public LangGraphChatClient bindTools(List<? extends Tool> tools, boolean parallelToolCalls) {
    Objects.requireNonNull(tools, "tools");
    return new LangGraphChatClient(
        constructorArguments(), openAIClient, List.copyOf(tools), parallelToolCalls);
  }

  public List<Tool> boundTools() {
    return boundTools;
  }

  public boolean parallelToolCalls() {
    return parallelToolCalls;
  }

  @Override
  public ChatCompletionCreateParams.Builder newRequest() {
    ChatCompletionCreateParams.Builder builder = super.newRequest();
    if (!boundTools.isEmpty()) {
      builder.tools(boundTools.stream().map(t -> convertTool(t.definition())).toList());
      builder.parallelToolCalls(parallelToolCalls);
    }
    return builder;
  }

  private static ChatCompletionTool convertTool(ToolDefinition def) {
    FunctionParameters.Builder params = FunctionParameters.builder();
    def.parameters()
        .forEach((key, value) -> params.putAdditionalProperty(key, JsonValue.from(value)));
    FunctionDefinition function =
        FunctionDefinition.builder()
            .name(def.name())
            .description(def.description())
            .parameters(params.build())
            .build();
    return ChatCompletionTool.ofFunction(
        ChatCompletionFunctionTool.builder().function(function).build());
  }

  @Override
  public String toString() {
    return "LangGraphChatClient{deployment="
        + deployment()
        + ", tools="
        + boundTools.stream().map(Tool::name).toList()
        + ", parallelToolCalls="
        + parallelToolCalls
        + '}';
  }
}
