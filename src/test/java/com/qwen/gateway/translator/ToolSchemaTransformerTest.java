package com.qwen.gateway.translator;

import com.qwen.gateway.dto.chat.ParamType;
import com.qwen.gateway.dto.chat.ToolDefinition;
import com.qwen.gateway.dto.chat.ToolParameter;
import com.qwen.gateway.exception.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolSchemaTransformerTest {

    private final ToolSchemaTransformer transformer = new ToolSchemaTransformer();

    @Test
    void shouldFlattenNestedObjectAndArrayParameters() {
        ToolParameter options = new ToolParameter("options", ParamType.OBJECT, false, null, null,
                List.of(ToolParameter.of("depth", ParamType.INTEGER, false, "Depth")), null, null);
        ToolParameter files = new ToolParameter("files", ParamType.ARRAY, false, "Files", null, null,
                ToolParameter.of(null, ParamType.STRING, false, null), null);
        ToolDefinition read = new ToolDefinition("read", "Read a file", List.of(
                ToolParameter.of("path", ParamType.STRING, true, "File path"), options, files));

        String block = transformer.transform(List.of(read));

        assertThat(block).startsWith("<tools>\n## read\nDescription: Read a file\nParameters:\n");
        assertThat(block).contains("- path: (required) string - File path\n");
        assertThat(block).contains("- options: (optional) object\n");
        assertThat(block).contains("- options.depth: (optional) integer - Depth\n");
        assertThat(block).contains("- files: (optional) array - Files\n- files[]: string\n");
        assertThat(block).endsWith("</tools>");
        assertThat(block.indexOf("- path:")).isLessThan(block.indexOf("- options:"));
        assertThat(block.indexOf("- options:")).isLessThan(block.indexOf("- files:"));
    }

    @Test
    void shouldRenderEnumsDefaultsAndObjectItems() {
        ToolParameter mode = new ToolParameter("mode", ParamType.ENUM, true, null,
                List.of("fast", "slow"), null, null, "fast");
        ToolParameter edit = new ToolParameter(null, ParamType.OBJECT, false, null, null,
                List.of(ToolParameter.of("line", ParamType.INTEGER, true, null)), null, null);
        ToolParameter edits = new ToolParameter("edits", ParamType.ARRAY, false, null, null, null, edit, null);

        String block = transformer.transform(List.of(new ToolDefinition("edit", null, List.of(mode, edits))));

        assertThat(block).contains("Description: No description\n");
        assertThat(block).contains("- mode: (required) enum(fast|slow) (default: fast)\n");
        assertThat(block).contains("- edits[]: object\n");
        assertThat(block).contains("- edits[].line: (required) integer\n");
    }

    @Test
    void shouldMarkToolsWithoutParameters() {
        String block = transformer.transform(List.of(new ToolDefinition("now", "Current time", List.of())));

        assertThat(block).contains("Parameters: none\n");
        assertThat(block).contains("<call>\n<name>now</name>\n<args>\n</args>\n</call>");
    }

    @Test
    void shouldRejectMissingOrDuplicateNames() {
        assertThatThrownBy(() -> transformer.transform(List.of(new ToolDefinition(" ", "x", List.of()))))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("缺少名称");

        ToolDefinition a = new ToolDefinition("a", null, List.of());
        assertThatThrownBy(() -> transformer.transform(List.of(a, a)))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("重复");
    }

    @Test
    void shouldInjectToolsIntoDefaultSystemPromptWhenNoneGiven() {
        ToolDefinition tool = new ToolDefinition("bash", "Run a command",
                List.of(ToolParameter.of("command", ParamType.STRING, true, null)));

        String injected = transformer.injectInto("", List.of(tool));

        assertThat(injected).startsWith(ToolSchemaTransformer.DEFAULT_SYSTEM_PROMPT);
        assertThat(injected).contains("TOOL USE");
        assertThat(injected).contains("## Available Tools");
        assertThat(injected).contains("## bash");
        assertThat(transformer.injectInto("Be brief.", List.of())).isEqualTo("Be brief.");
        assertThat(transformer.injectInto("Be brief.", List.of(tool))).startsWith("Be brief.\n\n====");
    }

    @Test
    void shouldRenderNestedArgumentsAsTags() {
        String call = transformer.renderCall("write", Map.of("files", List.of("a", "b")));

        assertThat(call).isEqualTo("""
                <call>
                <name>write</name>
                <args>
                <files>
                <item>a</item>
                <item>b</item>
                </files>
                </args>
                </call>""");
    }

    @Test
    void shouldUseRequiredParametersForExample() {
        ToolDefinition tool = new ToolDefinition("search", null, List.of(
                ToolParameter.of("query", ParamType.STRING, true, null),
                ToolParameter.of("limit", ParamType.INTEGER, false, null)));

        assertThat(transformer.exampleArguments(tool)).containsOnlyKeys("query");
    }
}
