package com.drawiomcp.tools;

import com.drawiomcp.annotation.DrawioMcpTool;
import com.drawiomcp.query.DiagramOperation;

@DrawioMcpTool(
    name = "Parse Drawio",
    description = "Lists the labelled shapes of a draw.io diagram grouped by page.",
    mcpName = "parse_drawio",
    title = "Parse Draw.io Components",
    readOnlyHint = true,
    idempotentHint = true,
    mcpDescription = """
    <use_case>
    List every labelled shape (non-connector cell with text) of a draw.io diagram, grouped by
    page, with its classified shape type, parent, hyperlink, tooltip and custom properties.
    </use_case>

    <return_value_summary>
    Returns total, returned, limit, truncated and pages; each page carries its own total and
    the components taken from it.
    </return_value_summary>

    <important_notes>
    - The limit applies across all pages. Without a limit the server default (100) is used.
    - truncated is true when more components exist than were returned.
    - Shape types: swimlane, decision, start-end, ellipse, database, cloud, process, bpmn,
      icon, hexagon, parallelogram, document, callout, note, text, group, rounded-rect, shape.
    </important_notes>

    <examples>
    {
      "file_path": "/home/user/diagrams/architecture.drawio",
      "page_name": "Backend",
      "limit": 50
    }
    </examples>
    """
)
public class ParseDrawioTool extends DiagramQueryTool {

    @Override
    protected DiagramOperation operation() {
        return DiagramOperation.COMPONENTS;
    }
}
