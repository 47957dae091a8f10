package com.drawiomcp.tools;

import java.util.Map;

import com.drawiomcp.annotation.DrawioMcpTool;
import com.drawiomcp.query.DiagramOperation;
import com.drawiomcp.query.QueryOptions;
import com.drawiomcp.utils.jsonschema.JsonSchema;
import com.drawiomcp.utils.jsonschema.SchemaBuilder;
import com.drawiomcp.utils.jsonschema.SchemaBuilder.IObjectSchemaBuilder;

import io.modelcontextprotocol.common.McpTransportContext;
import reactor.core.publisher.Mono;

@DrawioMcpTool(
    name = "Query Diagram",
    description = "Runs any diagram read operation selected by name.",
    mcpName = "query_diagram",
    title = "Query Diagram",
    readOnlyHint = true,
    idempotentHint = true,
    mcpDescription = """
    <use_case>
    Single entry point for every diagram read. Select the operation by name instead of calling
    the dedicated tool.
    </use_case>

    <important_notes>
    - operation is one of: overview, components, text_inventory, classes, relationships, render.
      Dedicated tool names such as extract_classes are accepted too.
    - An unknown operation is rejected before the file is read.
    </important_notes>

    <examples>
    {
      "operation": "relationships",
      "file_path": "/home/user/diagrams/architecture.drawio",
      "limit": 20
    }
    </examples>
    """
)
public class QueryDiagramTool extends BaseMcpTool {

    @Override
    public JsonSchema schema() {
        IObjectSchemaBuilder schemaRoot = createBaseSchemaNode();

        schemaRoot.property(ARG_OPERATION,
                SchemaBuilder.string(mapper)
                        .description("The read operation to run.")
                        .enumValues(DiagramOperation.operationNames().toArray(new String[0])));

        schemaRoot.property(ARG_FILE_PATH,
                SchemaBuilder.string(mapper)
                        .description("Path to the .drawio or .xml diagram file.")
                        .minLength(1));

        schemaRoot.property(ARG_PAGE_NAME,
                SchemaBuilder.string(mapper)
                        .description("Optional page name. When given, only that page is processed."));

        schemaRoot.property(ARG_LIMIT,
                SchemaBuilder.integer(mapper)
                        .description("Maximum number of items returned by listing operations.")
                        .minimum(1));

        schemaRoot.requiredProperty(ARG_OPERATION);
        schemaRoot.requiredProperty(ARG_FILE_PATH);

        return schemaRoot.build();
    }

    @Override
    public Mono<? extends Object> execute(McpTransportContext context, Map<String, Object> args,
            DrawioToolContext tool) {
        String operation = getRequiredStringArgument(args, ARG_OPERATION);
        String filePath = getRequiredStringArgument(args, ARG_FILE_PATH);
        QueryOptions options = getQueryOptions(args, tool);
        return runBlocking(() -> tool.queryService().execute(operation, filePath, options));
    }
}
