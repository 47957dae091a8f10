package com.drawiomcp.tools;

import com.drawiomcp.annotation.DrawioMcpTool;
import com.drawiomcp.query.DiagramOperation;

@DrawioMcpTool(
    name = "Render Diagram Hierarchy",
    description = "Renders the containment tree and connections of each page of a draw.io diagram.",
    mcpName = "render_diagram_hierarchy",
    title = "Render Diagram Hierarchy",
    readOnlyHint = true,
    idempotentHint = true,
    mcpDescription = """
    <use_case>
    Understand how a draw.io diagram is organized: which shapes sit inside which containers,
    which connectors leave each shape, and which labelled shapes are stranded inside unlabelled
    containers.
    </use_case>

    <return_value_summary>
    Returns one render per page with tree, connections, orphans and an indented text outline.
    </return_value_summary>

    <important_notes>
    - Unlabelled containers are transparent: their children are lifted to the enclosing level.
    - The outline is the same whether the page was stored compressed or as plain XML.
    </important_notes>
    """
)
public class RenderDiagramHierarchyTool extends DiagramQueryTool {

    @Override
    protected DiagramOperation operation() {
        return DiagramOperation.RENDER;
    }

    @Override
    protected boolean acceptsLimit() {
        return false;
    }
}
