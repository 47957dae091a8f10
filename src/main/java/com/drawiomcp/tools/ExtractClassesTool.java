package com.drawiomcp.tools;

import com.drawiomcp.annotation.DrawioMcpTool;
import com.drawiomcp.query.DiagramOperation;

@DrawioMcpTool(
    name = "Extract Classes",
    description = "Lists class-like containers of a draw.io diagram with their members.",
    mcpName = "extract_classes",
    title = "Extract Diagram Classes",
    readOnlyHint = true,
    idempotentHint = true,
    mcpDescription = """
    <use_case>
    Recover UML-style classes from a draw.io diagram. Swimlanes and process shapes that carry
    a label are reported as classes; the first label line is the class name and the remaining
    lines plus the labels of contained cells are its members.
    </use_case>

    <return_value_summary>
    Returns pages of classes with id, name, members, shape_type and page.
    </return_value_summary>

    <important_notes>
    - Returns everything unless a limit is given.
    - Containers without a label are not classes.
    </important_notes>
    """
)
public class ExtractClassesTool extends DiagramQueryTool {

    @Override
    protected DiagramOperation operation() {
        return DiagramOperation.CLASSES;
    }
}
