package com.drawiomcp.query;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Predicate;

import com.drawiomcp.config.ServerConfig;
import com.drawiomcp.diagram.DiagramDocument;
import com.drawiomcp.diagram.DiagramLoader;
import com.drawiomcp.diagram.DiagramNode;
import com.drawiomcp.diagram.DiagramPage;
import com.drawiomcp.diagram.HtmlText;
import com.drawiomcp.diagram.ShapeType;
import com.drawiomcp.exceptions.DrawioMcpException;
import com.drawiomcp.models.ClassInfo;
import com.drawiomcp.models.ComponentInfo;
import com.drawiomcp.models.DiagramOverview;
import com.drawiomcp.models.GroupedListing;
import com.drawiomcp.models.HierarchyRender;
import com.drawiomcp.models.HyperlinkInfo;
import com.drawiomcp.models.PageEntries;
import com.drawiomcp.models.PageRender;
import com.drawiomcp.models.PageSummary;
import com.drawiomcp.models.RelationshipInfo;
import com.drawiomcp.models.TextItem;
import com.drawiomcp.utils.DrawioMcpErrorUtils;

/**
 * Read-only projections over a diagram file.
 * <p>
 * Each call loads the file afresh and keeps no state between calls, so the
 * service is safe to share across concurrent requests. Results follow
 * document order. A page filter naming no page fails with
 * {@code PAGE_NOT_FOUND}; an existing page without cells is an empty success.
 */
public class DiagramQueryService {

	/** Hyperlink texts in the overview are cut to this length. */
	public static final int HYPERLINK_TEXT_LENGTH = 60;

	private final DiagramLoader loader;
	private final int defaultLimit;
	private final HierarchyRenderer renderer;

	public DiagramQueryService(DiagramLoader loader, ServerConfig config) {
		this(loader, config.getDefaultLimit(), config.getRenderMaxDepth());
	}

	public DiagramQueryService(DiagramLoader loader, int defaultLimit, int renderMaxDepth) {
		this.loader = loader;
		this.defaultLimit = defaultLimit;
		this.renderer = new HierarchyRenderer(renderMaxDepth);
	}

	/**
	 * Runs an operation by name.
	 *
	 * @throws DrawioMcpException {@code UNKNOWN_OPERATION} for an unrecognized
	 *                            name, before the file is read
	 */
	public Object execute(String operation, String filePath, QueryOptions options) {
		DiagramOperation op = DiagramOperation.fromName(operation)
				.orElseThrow(() -> new DrawioMcpException(DrawioMcpErrorUtils.unknownOperation(operation,
						DiagramOperation.operationNames(), "query_diagram")));
		return execute(op, filePath, options);
	}

	public Object execute(DiagramOperation operation, String filePath, QueryOptions options) {
		switch (operation) {
			case OVERVIEW:
				return overview(filePath, options);
			case COMPONENTS:
				return components(filePath, options);
			case TEXT_INVENTORY:
				return textInventory(filePath, options);
			case CLASSES:
				return classes(filePath, options);
			case RELATIONSHIPS:
				return relationships(filePath, options);
			case RENDER:
				return render(filePath, options);
			default:
				throw new IllegalStateException("Unhandled operation: " + operation);
		}
	}

	public DiagramOverview overview(String filePath, QueryOptions options) {
		DiagramDocument document = loader.load(filePath, DiagramOperation.OVERVIEW.getOperationName());
		List<DiagramPage> pages = selectPages(document, options, DiagramOperation.OVERVIEW);

		List<PageSummary> summaries = new ArrayList<>();
		List<PageSummary> failures = new ArrayList<>();
		List<HyperlinkInfo> hyperlinks = new ArrayList<>();
		int totalCells = 0;
		int withText = 0;
		int connections = 0;
		int swimlanes = 0;
		int decisions = 0;

		for (DiagramPage page : pages) {
			PageSummary summary = new PageSummary(page.getIndex(), page.getDisplayName(), page.getCells().size(),
					page.isCompressed(), page.getDecompressionFailure());
			summaries.add(summary);
			if (page.getDecompressionFailure() != null) {
				failures.add(summary);
			}
			for (DiagramNode node : page.getNodes()) {
				totalCells++;
				if (node.hasText()) {
					withText++;
				}
				if (node.isEdge()) {
					connections++;
				} else {
					ShapeType type = node.getShapeType();
					if (type == ShapeType.SWIMLANE) {
						swimlanes++;
					} else if (type == ShapeType.DECISION) {
						decisions++;
					}
				}
				if (node.getCell().hasHyperlink()) {
					hyperlinks.add(new HyperlinkInfo(node.getId(), page.getDisplayName(),
							HtmlText.truncate(node.getText(), HYPERLINK_TEXT_LENGTH), node.getCell().getHyperlink()));
				}
			}
		}
		return new DiagramOverview(filePath, options.pageName(), summaries, totalCells, withText, connections,
				swimlanes, decisions, hyperlinks, failures);
	}

	/**
	 * Non-edge cells with text. Capped at the requested or default limit.
	 */
	public GroupedListing<ComponentInfo> components(String filePath, QueryOptions options) {
		return listing(filePath, options, DiagramOperation.COMPONENTS, effectiveLimit(options),
				node -> !node.isEdge() && node.hasText(), (page, node) -> Projections.component(node));
	}

	/**
	 * Every cell with text, edges included. Uncapped unless a limit is given.
	 */
	public GroupedListing<TextItem> textInventory(String filePath, QueryOptions options) {
		return listing(filePath, options, DiagramOperation.TEXT_INVENTORY, options.limit(),
				DiagramNode::hasText, (page, node) -> Projections.text(node));
	}

	/**
	 * Swimlanes and process shapes carrying text. Uncapped unless a limit is given.
	 */
	public GroupedListing<ClassInfo> classes(String filePath, QueryOptions options) {
		return listing(filePath, options, DiagramOperation.CLASSES, options.limit(),
				node -> !node.isEdge() && node.hasText() && node.getShapeType().isClassLike(),
				Projections::classInfo);
	}

	/**
	 * Every edge with resolved endpoints. Capped at the requested or default limit.
	 */
	public GroupedListing<RelationshipInfo> relationships(String filePath, QueryOptions options) {
		return listing(filePath, options, DiagramOperation.RELATIONSHIPS, effectiveLimit(options),
				DiagramNode::isEdge, Projections::relationship);
	}

	public HierarchyRender render(String filePath, QueryOptions options) {
		return render(loader.load(filePath, DiagramOperation.RENDER.getOperationName()), options);
	}

	/**
	 * Renders the pages of an already loaded document.
	 */
	public HierarchyRender render(DiagramDocument document, QueryOptions options) {
		List<PageRender> pages = new ArrayList<>();
		for (DiagramPage page : selectPages(document, options, DiagramOperation.RENDER)) {
			pages.add(renderer.render(page));
		}
		return new HierarchyRender(document.getSourceId(), options.pageName(), pages);
	}

	private <T> GroupedListing<T> listing(String filePath, QueryOptions options, DiagramOperation operation,
			Integer limit, Predicate<DiagramNode> filter, BiFunction<DiagramPage, DiagramNode, T> projection) {
		DiagramDocument document = loader.load(filePath, operation.getOperationName());
		List<PageEntries<T>> groups = new ArrayList<>();
		int total = 0;
		int remaining = limit != null ? limit : Integer.MAX_VALUE;

		for (DiagramPage page : selectPages(document, options, operation)) {
			List<T> items = new ArrayList<>();
			int pageTotal = 0;
			for (DiagramNode node : page.getNodes()) {
				if (!filter.test(node)) {
					continue;
				}
				pageTotal++;
				if (remaining > 0) {
					items.add(projection.apply(page, node));
					remaining--;
				}
			}
			total += pageTotal;
			groups.add(new PageEntries<>(page.getDisplayName(), pageTotal, items));
		}
		return new GroupedListing<>(options.pageName(), total, limit, groups);
	}

	private int effectiveLimit(QueryOptions options) {
		return options.limit() != null ? options.limit() : defaultLimit;
	}

	private static List<DiagramPage> selectPages(DiagramDocument document, QueryOptions options,
			DiagramOperation operation) {
		if (options.pageName() == null) {
			return document.getPages();
		}
		DiagramPage page = document.findPage(options.pageName())
				.orElseThrow(() -> new DrawioMcpException(DrawioMcpErrorUtils.pageNotFound(options.pageName(),
						document.getPageNames(), operation.getOperationName())));
		return List.of(page);
	}
}
