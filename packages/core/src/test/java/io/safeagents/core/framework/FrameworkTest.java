package io.safeagents.core.framework;

import static org.junit.jupiter.api.Assertions.*;

import io.safeagents.core.exception.UnsupportedFrameworkException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FrameworkTest {

  @Test
  void resolvesIdsLabelsAndEnumNames() {
    assertEquals(Framework.AUTOGEN, Framework.fromId("autogen"));
    assertEquals(Framework.AUTOGEN, Framework.fromId("Autogen"));
    assertEquals(Framework.LANGGRAPH, Framework.fromId(" LangGraph "));
    assertEquals(Framework.OPENAI_AGENTS, Framework.fromId("OpenAI Agents"));
    assertEquals(Framework.OPENAI_AGENTS, Framework.fromId("openai-agents"));
    assertEquals(Framework.OPENAI_AGENTS, Framework.fromId("OPENAI_AGENTS"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "  ", "crewai", "semantic_kernel"})
  void rejectsUnknownSelectors(String value) {
    assertThrows(UnsupportedFrameworkException.class, () -> Framework.fromId(value));
  }

  @Test
  void rejectsNull() {
    assertThrows(UnsupportedFrameworkException.class, () -> Framework.fromId(null));
  }

  @Test
  void idsAreUnique() {
    assertEquals(
        Framework.values().length,
        java.util.Arrays.stream(Framework.values()).map(Framework::id).distinct().count());
  }
}
