package com.drawiomcp.tools;

import com.drawiomcp.annotation.DrawioMcpTool;
import com.drawiomcp.query.DiagramOperation;

@DrawioMcpTool(
    name = "Diagram Overview",
    description = "Summarizes the pages, cells, connections and hyperlinks of a draw.io diagram.",
    mcpName = "get_diagram_overview",
    title = "Get Diagram Overview",
    readOnlyHint = true,
    idempotentHint = true,
    mcpDescription = """
    <use_case>
    Get a quick summary of a draw.io diagram before extracting details. Lists every page with
    its cell count and whether its content was compressed, and counts text cells, connections,
    swimlanes and decision shapes.
    </use_case>

    <return_value_summary>
    Returns file_path, total_pages, pages (index, name, cells, compressed), total_cells,
    cells_with_text, total_connections, swimlanes, decisions, hyperlinks and
    decompression_failures.
    </return_value_summary>

    <important_notes>
    - Use the page names returned here as page_name in the other diagram tools.
    - A page whose compressed content cannot be decoded is listed with zero cells and its
      failure reason instead of failing the whole call.
    - Hyperlink texts are cut to 60 characters.
    </important_notes>

    <examples>
    {
      "file_path": "/home/user/diagrams/architecture.drawio"
    }
    </examples>
    """
)
public class DiagramOverviewTool extends DiagramQueryTool {

    @Override
    protected DiagramOperation operation() {
        return DiagramOperation.OVERVIEW;
    }

    @Override
    protected boolean acceptsLimit() {
        return false;
    }
}
