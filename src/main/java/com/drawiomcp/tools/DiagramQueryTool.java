package com.drawiomcp.tools;

import java.util.Map;

import com.drawiomcp.query.DiagramOperation;
import com.drawiomcp.query.QueryOptions;
import com.drawiomcp.utils.jsonschema.JsonSchema;
import com.drawiomcp.utils.jsonschema.SchemaBuilder;
import com.drawiomcp.utils.jsonschema.SchemaBuilder.IObjectSchemaBuilder;

import io.modelcontextprotocol.common.McpTransportContext;
import reactor.core.publisher.Mono;

/**
 * A tool bound to a single {@link DiagramOperation}. Every such tool takes a
 * {@code file_path}, an optional {@code page_name} and, for listings, an
 * optional {@code limit}.
 */
public abstract class DiagramQueryTool extends BaseMcpTool {

    /** The operation this tool runs. */
    protected abstract DiagramOperation operation();

    /** Whether {@code limit} is advertised in the input schema. */
    protected boolean acceptsLimit() {
        return true;
    }

    @Override
    public JsonSchema schema() {
        IObjectSchemaBuilder schemaRoot = createBaseSchemaNode();

        schemaRoot.property(ARG_FILE_PATH,
                SchemaBuilder.string(mapper)
                        .description("Path to the .drawio or .xml diagram file.")
                        .minLength(1));

        schemaRoot.property(ARG_PAGE_NAME,
                SchemaBuilder.string(mapper)
                        .description("Optional page name. When given, only that page is processed."));

        if (acceptsLimit()) {
            schemaRoot.property(ARG_LIMIT,
                    SchemaBuilder.integer(mapper)
                            .description("Maximum number of items returned across all pages.")
                            .minimum(1));
        }

        schemaRoot.requiredProperty(ARG_FILE_PATH);

        return schemaRoot.build();
    }

    @Override
    public Mono<? extends Object> execute(McpTransportContext context, Map<String, Object> args,
            DrawioToolContext tool) {
        String filePath = getRequiredStringArgument(args, ARG_FILE_PATH);
        QueryOptions options = getQueryOptions(args, tool);
        return runBlocking(() -> tool.queryService().execute(operation(), filePath, options));
    }

    @Override
    protected String getOperationFromArgs(Map<String, Object> args) {
        return operation().getOperationName();
    }
}
