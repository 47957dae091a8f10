package com.drawiomcp.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.drawiomcp.config.ServerConfig;
import com.drawiomcp.diagram.DiagramFixtures;
import com.drawiomcp.diagram.DiagramLoader;
import com.drawiomcp.query.DiagramQueryService;
import com.drawiomcp.utils.JsonMapperHolder;
import com.fasterxml.jackson.databind.JsonNode;

import io.modelcontextprotocol.common.McpTransportContext;
import io.modelcontextprotocol.server.McpStatelessServerFeatures.AsyncToolSpecification;
import io.modelcontextprotocol.spec.McpSchema.CallToolRequest;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.TextContent;

/**
 * Base test class for drawio MCP tools. Runs tools through their generated
 * MCP specification against diagram files written to a temporary directory.
 */
@ExtendWith(MockitoExtension.class)
public abstract class BaseToolTest {

    protected static final String SAMPLE_CELLS =
        "<mxCell id=\"c1\" value=\"Customer&lt;br&gt;+ id: int\" style=\"swimlane;\" vertex=\"1\" parent=\"1\"/>"
            + "<mxCell id=\"c2\" value=\"Order\" style=\"swimlane;\" vertex=\"1\" parent=\"1\"/>"
            + "<mxCell id=\"d\" value=\"Valid?\" style=\"rhombus;\" vertex=\"1\" parent=\"1\"/>"
            + "<mxCell id=\"e1\" value=\"places\" style=\"endArrow=open;\" edge=\"1\" parent=\"1\" source=\"c1\" target=\"c2\"/>";

    @Mock
    protected McpTransportContext mockContext;

    @TempDir
    protected Path tempDir;

    protected DrawioToolContext toolContext;
    protected String sampleFile;

    @BeforeEach
    void setUpContext() throws Exception {
        ServerConfig config = ServerConfig.defaults();
        toolContext = new DrawioToolContext(new DiagramQueryService(new DiagramLoader(), config), config);
        sampleFile = DiagramFixtures.write(tempDir, "sample.drawio", DiagramFixtures.mxfile(
            DiagramFixtures.compressedPage("Domain", SAMPLE_CELLS))).toString();
    }

    /**
     * Invokes the tool the way the MCP server does and returns the raw result.
     */
    protected CallToolResult callTool(BaseMcpTool tool, Map<String, Object> args) {
        AsyncToolSpecification spec = tool.specification(toolContext);
        assertNotNull(spec, "specification should be generated");
        CallToolResult result = spec.callHandler()
            .apply(mockContext, new CallToolRequest(tool.getMcpName(), args))
            .block();
        assertNotNull(result);
        return result;
    }

    /**
     * Invokes the tool and parses the JSON envelope from its text content.
     */
    protected JsonNode callForEnvelope(BaseMcpTool tool, Map<String, Object> args) throws Exception {
        CallToolResult result = callTool(tool, args);
        assertFalse(result.content().isEmpty());
        String json = ((TextContent) result.content().get(0)).text();
        JsonNode envelope = JsonMapperHolder.getMapper().readTree(json);
        assertEquals(!envelope.path("success").asBoolean(), Boolean.TRUE.equals(result.isError()));
        return envelope;
    }

    protected static void assertSuccess(JsonNode envelope) {
        assertTrue(envelope.path("success").asBoolean(), () -> "expected success but got " + envelope);
    }

    protected static void assertErrorCode(JsonNode envelope, String expectedCode) {
        assertFalse(envelope.path("success").asBoolean(), () -> "expected failure but got " + envelope);
        assertEquals(expectedCode, envelope.path("error").path("error_code").asText(), envelope::toString);
    }
}
