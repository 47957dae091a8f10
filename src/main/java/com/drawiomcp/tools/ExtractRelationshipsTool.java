package com.drawiomcp.tools;

import com.drawiomcp.annotation.DrawioMcpTool;
import com.drawiomcp.query.DiagramOperation;

@DrawioMcpTool(
    name = "Extract Relationships",
    description = "Lists the connectors of a draw.io diagram with resolved endpoints and relation types.",
    mcpName = "extract_relationships",
    title = "Extract Diagram Relationships",
    readOnlyHint = true,
    idempotentHint = true,
    mcpDescription = """
    <use_case>
    List every connector of a draw.io diagram with its source and target, the labels of both
    endpoints and the relation type inferred from its line style.
    </use_case>

    <return_value_summary>
    Returns pages of relationships with id, source, target, source_name, target_name, label,
    type and page.
    </return_value_summary>

    <important_notes>
    - Relation types: dependency, inheritance, flow, composition, async-message, aggregation,
      association.
    - An endpoint without a label is named by its raw id; a missing endpoint is "?".
    - The limit applies across all pages. Without a limit the server default (100) is used.
    </important_notes>
    """
)
public class ExtractRelationshipsTool extends DiagramQueryTool {

    @Override
    protected DiagramOperation operation() {
        return DiagramOperation.RELATIONSHIPS;
    }
}
