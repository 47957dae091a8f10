package com.drawiomcp.tools;

import com.drawiomcp.annotation.DrawioMcpTool;
import com.drawiomcp.query.DiagramOperation;

@DrawioMcpTool(
    name = "Extract Text Content",
    description = "Lists all visible text of a draw.io diagram, connector labels included.",
    mcpName = "extract_text_content",
    title = "Extract Diagram Text",
    readOnlyHint = true,
    idempotentHint = true,
    mcpDescription = """
    <use_case>
    Collect every piece of visible text in a draw.io diagram, shapes and connector labels
    alike, with HTML markup removed and entities decoded.
    </use_case>

    <return_value_summary>
    Returns pages of items with id, text and is_edge, plus total, returned and truncated.
    </return_value_summary>

    <important_notes>
    - Returns everything unless a limit is given.
    - Cells whose label is empty after markup removal are skipped.
    </important_notes>
    """
)
public class ExtractTextContentTool extends DiagramQueryTool {

    @Override
    protected DiagramOperation operation() {
        return DiagramOperation.TEXT_INVENTORY;
    }
}
