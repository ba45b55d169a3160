package io.safeagents.core.exception;

import static org.junit.jupiter.api.Assertions.*;

import io.safeagents.core.framework.Framework;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SafeAgentsExceptionTest {

  @Test
  void contextIsCopiedAndUnmodifiable() {
    Map<String, Object> context = new HashMap<>();
    context.put("key", "value");

    SafeAgentsException ex =
        new SafeAgentsException(ErrorCode.CONFIGURATION_ERROR, "bad", context);
    context.put("other", "later");

    assertEquals(Map.of("key", "value"), ex.getContext());
    assertThrows(UnsupportedOperationException.class, () -> ex.getContext().put("x", 1));
  }

  @Test
  void constructionErrorCarriesFrameworkAndCause() {
    IllegalStateException cause = new IllegalStateException("sdk");

    ClientConstructionException ex =
        new ClientConstructionException(Framework.OPENAI_AGENTS, "boom", cause);

    assertEquals(Framework.OPENAI_AGENTS, ex.framework());
    assertSame(cause, ex.getCause());
    assertEquals("OpenAI Agents", ex.getContext().get("framework"));
    assertTrue(ex.getMessage().startsWith("[OpenAI Agents]"));
    assertTrue(ex.toString().contains("cause=IllegalStateException"));
  }

  @Test
  void rethrowIfUncheckedKeepsTypedExceptions() {
    ConfigException typed = new ConfigException("typed");

    assertSame(
        typed, ExceptionUtil.rethrowIfUnchecked(typed, t -> new ConfigException("wrapped", t)));
  }

  @Test
  void rethrowIfUncheckedWrapsOthers() {
    RuntimeException raw = new RuntimeException("raw");

    SafeAgentsException wrapped =
        ExceptionUtil.rethrowIfUnchecked(raw, t -> new ConfigException("wrapped", t));

    assertEquals(ErrorCode.CONFIGURATION_ERROR, wrapped.getCode());
    assertSame(raw, wrapped.getCause());
  }
}
