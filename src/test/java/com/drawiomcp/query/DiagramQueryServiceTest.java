package com.drawiomcp.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.drawiomcp.diagram.DiagramFixtures;
import com.drawiomcp.diagram.DiagramLoader;
import com.drawiomcp.diagram.RelationType;
import com.drawiomcp.diagram.ShapeType;
import com.drawiomcp.exceptions.DrawioMcpException;
import com.drawiomcp.models.ClassInfo;
import com.drawiomcp.models.ComponentInfo;
import com.drawiomcp.models.DiagramOverview;
import com.drawiomcp.models.DrawioMcpError;
import com.drawiomcp.models.GroupedListing;
import com.drawiomcp.models.HierarchyRender;
import com.drawiomcp.models.PageEntries;
import com.drawiomcp.models.PageRender;
import com.drawiomcp.models.RelationshipInfo;
import com.drawiomcp.models.RenderedNode;
import com.drawiomcp.models.TextItem;
import com.drawiomcp.utils.JsonMapperHolder;

class DiagramQueryServiceTest {

	static final String ARCHITECTURE_CELLS =
			"<mxCell id=\"lane\" value=\"\" style=\"swimlane;\" vertex=\"1\" parent=\"1\"/>"
					+ "<mxCell id=\"api\" value=\"API &lt;b&gt;Gateway&lt;/b&gt;\" style=\"rounded=1;\" vertex=\"1\" parent=\"lane\"/>"
					+ "<mxCell id=\"db\" value=\"Orders DB\" style=\"shape=cylinder3;\" vertex=\"1\" parent=\"lane\"/>"
					+ "<mxCell id=\"e1\" value=\"reads\" style=\"endArrow=block;\" edge=\"1\" parent=\"lane\" source=\"api\" target=\"db\"/>";

	static final String CLASSES_CELLS =
			"<mxCell id=\"c1\" value=\"Customer&lt;br&gt;+ id: int\" style=\"swimlane;\" vertex=\"1\" parent=\"1\"/>"
					+ "<mxCell id=\"f1\" value=\"+ name: String\" style=\"text;\" vertex=\"1\" parent=\"c1\"/>"
					+ "<mxCell id=\"c2\" value=\"Order\" style=\"swimlane;\" vertex=\"1\" parent=\"1\"/>"
					+ "<mxCell id=\"e2\" value=\"\" style=\"endArrow=block;endFill=0;\" edge=\"1\" parent=\"1\" source=\"c2\" target=\"c1\"/>"
					+ "<UserObject id=\"lnk\" label=\"Docs\" link=\"https://example.com/docs\" owner=\"platform\">"
					+ "<mxCell style=\"ellipse;\" vertex=\"1\" parent=\"1\"/></UserObject>"
					+ "<mxCell id=\"e3\" edge=\"1\" parent=\"1\" source=\"c1\" target=\"ghost\"/>";

	@TempDir
	Path tempDir;

	private DiagramQueryService service;
	private String twoPageFile;

	@BeforeEach
	void setUp() throws Exception {
		service = new DiagramQueryService(new DiagramLoader(), 100, 64);
		twoPageFile = DiagramFixtures.write(tempDir, "system.drawio", DiagramFixtures.mxfile(
				DiagramFixtures.inlinePage("Architecture", ARCHITECTURE_CELLS),
				DiagramFixtures.compressedPage("Classes", CLASSES_CELLS))).toString();
	}

	private static <T> List<T> items(GroupedListing<T> listing) {
		return listing.getPages().stream().flatMap(page -> page.items().stream()).collect(Collectors.toList());
	}

	@Nested
	@DisplayName("Overview")
	class Overview {

		@Test
		void summarizesEveryPage() {
			DiagramOverview overview = service.overview(twoPageFile, QueryOptions.all());

			assertEquals(2, overview.getTotalPages());
			assertEquals(List.of("Architecture", "Classes"),
					overview.getPages().stream().map(p -> p.name()).collect(Collectors.toList()));
			assertFalse(overview.getPages().get(0).compressed());
			assertTrue(overview.getPages().get(1).compressed());
			assertEquals(14, overview.getTotalCells());
			assertEquals(7, overview.getCellsWithText());
			assertEquals(3, overview.getTotalConnections());
			assertEquals(3, overview.getSwimlanes());
			assertEquals(0, overview.getDecisions());
			assertEquals(1, overview.getHyperlinks().size());
			assertEquals("https://example.com/docs", overview.getHyperlinks().get(0).link());
			assertEquals("Classes", overview.getHyperlinks().get(0).page());
			assertTrue(overview.getDecompressionFailures().isEmpty());
		}

		@Test
		void swimlaneWithTwoShapesAndAnEmptyPage() throws Exception {
			String file = DiagramFixtures.write(tempDir, "two-pages.drawio", DiagramFixtures.mxfile(
					DiagramFixtures.inlinePage("A",
							"<mxCell id=\"lane\" value=\"\" style=\"swimlane;\" vertex=\"1\" parent=\"1\"/>"
									+ "<mxCell id=\"x\" value=\"Checkout\" vertex=\"1\" parent=\"lane\"/>"
									+ "<mxCell id=\"y\" value=\"Payment\" vertex=\"1\" parent=\"lane\"/>"
									+ "<mxCell id=\"e\" style=\"endArrow=block;\" edge=\"1\" parent=\"lane\" source=\"x\" target=\"y\"/>"),
					DiagramFixtures.inlinePage("B", ""))).toString();

			DiagramOverview overview = service.overview(file, QueryOptions.all());
			GroupedListing<ComponentInfo> components = service.components(file, QueryOptions.page("A"));
			GroupedListing<RelationshipInfo> relationships = service.relationships(file, QueryOptions.page("A"));

			assertEquals(2, overview.getTotalPages());
			assertEquals(1, overview.getSwimlanes());
			assertEquals(1, overview.getTotalConnections());
			assertEquals(List.of("x", "y"), items(components).stream().map(c -> c.id()).collect(Collectors.toList()));
			assertEquals(1, items(relationships).size());
			assertEquals("Checkout", items(relationships).get(0).sourceName());
			assertEquals("Payment", items(relationships).get(0).targetName());
		}

		@Test
		void reportsCorruptPagesWithoutFailing() throws Exception {
			String file = DiagramFixtures.write(tempDir, "corrupt.drawio", DiagramFixtures.mxfile(
					"<diagram name=\"Broken\">AAAA</diagram>",
					DiagramFixtures.inlinePage("Fine", ARCHITECTURE_CELLS))).toString();

			DiagramOverview overview = service.overview(file, QueryOptions.all());

			assertEquals(2, overview.getTotalPages());
			assertEquals(1, overview.getDecompressionFailures().size());
			assertEquals("Broken", overview.getDecompressionFailures().get(0).name());
			assertEquals(0, overview.getPages().get(0).cells());
		}

		@Test
		void hyperlinkTextIsTruncated() throws Exception {
			String longLabel = "x".repeat(90);
			String file = DiagramFixtures.write(tempDir, "links.drawio", DiagramFixtures.model(
					"<UserObject id=\"u\" label=\"" + longLabel + "\" link=\"data:page/id,abc\">"
							+ "<mxCell vertex=\"1\" parent=\"1\"/></UserObject>")).toString();

			DiagramOverview overview = service.overview(file, QueryOptions.all());

			assertEquals(DiagramQueryService.HYPERLINK_TEXT_LENGTH, overview.getHyperlinks().get(0).text().length());
			assertEquals(DiagramLoader.SINGLE_PAGE_NAME, overview.getHyperlinks().get(0).page());
		}
	}

	@Nested
	@DisplayName("Listings")
	class Listings {

		@Test
		void componentsOfOnePage() {
			GroupedListing<ComponentInfo> listing = service.components(twoPageFile, QueryOptions.page("Architecture"));

			assertEquals(2, listing.getTotal());
			assertEquals(1, listing.getPages().size());
			List<ComponentInfo> components = items(listing);
			assertEquals("API Gateway", components.get(0).text());
			assertEquals(ShapeType.ROUNDED_RECT, components.get(0).type());
			assertEquals("lane", components.get(0).parentId());
			assertEquals(ShapeType.DATABASE, components.get(1).type());
			assertFalse(listing.isTruncated());
		}

		@Test
		void componentsCarryWrapperMetadata() {
			ComponentInfo docs = items(service.components(twoPageFile, QueryOptions.page("Classes"))).stream()
					.filter(c -> "lnk".equals(c.id()))
					.findFirst()
					.orElseThrow();

			assertTrue(docs.hasLink());
			assertEquals("https://example.com/docs", docs.link());
			assertEquals("platform", docs.properties().get("owner"));
			assertEquals(ShapeType.ELLIPSE, docs.type());
		}

		@Test
		void textInventoryIncludesEdgeLabels() {
			List<TextItem> texts = items(service.textInventory(twoPageFile, QueryOptions.all()));

			assertEquals(7, texts.size());
			assertTrue(texts.stream().anyMatch(t -> t.isEdge() && "reads".equals(t.text())));
		}

		@Test
		void classesUseFirstLineAsNameAndTheRestAsMembers() {
			List<ClassInfo> classes = items(service.classes(twoPageFile, QueryOptions.all()));

			assertEquals(List.of("Customer", "Order"),
					classes.stream().map(ClassInfo::name).collect(Collectors.toList()));
			assertEquals(List.of("+ id: int", "+ name: String"), classes.get(0).members());
			assertTrue(classes.get(1).members().isEmpty());
			assertEquals("Classes", classes.get(0).page());
		}

		@Test
		void relationshipsResolveEndpoints() {
			List<RelationshipInfo> relations = items(service.relationships(twoPageFile, QueryOptions.all()));

			assertEquals(3, relations.size());
			RelationshipInfo reads = relations.get(0);
			assertEquals("API Gateway", reads.sourceName());
			assertEquals("Orders DB", reads.targetName());
			assertEquals("reads", reads.label());
			assertEquals(RelationType.FLOW, reads.type());
			assertEquals(RelationType.INHERITANCE, relations.get(1).type());
			assertEquals("Order", relations.get(1).sourceName());
			assertEquals("ghost", relations.get(2).targetName());
			assertEquals(RelationType.ASSOCIATION, relations.get(2).type());
		}

		@Test
		void edgeWithoutEndpointsUsesPlaceholders() throws Exception {
			String file = DiagramFixtures.write(tempDir, "dangling.drawio", DiagramFixtures.model(
					"<mxCell id=\"blank\" value=\"\" vertex=\"1\" parent=\"1\"/>"
							+ "<mxCell id=\"e\" value=\"x\" edge=\"1\" parent=\"1\"/>"
							+ "<mxCell id=\"f\" edge=\"1\" parent=\"1\" source=\"blank\"/>")).toString();

			List<RelationshipInfo> relations = items(service.relationships(file, QueryOptions.all()));

			assertEquals("?", relations.get(0).sourceName());
			assertEquals("?", relations.get(0).targetName());
			assertEquals("blank", relations.get(1).sourceName());
		}

		@Test
		void limitAppliesAcrossPagesAndFlagsTruncation() {
			GroupedListing<TextItem> listing = service.textInventory(twoPageFile, new QueryOptions(null, 2));

			assertEquals(7, listing.getTotal());
			assertEquals(2, listing.getReturned());
			assertEquals(Integer.valueOf(2), listing.getLimit());
			assertTrue(listing.isTruncated());
			PageEntries<TextItem> second = listing.getPages().get(1);
			assertEquals(4, second.total());
			assertTrue(second.items().isEmpty());
		}

		@Test
		void cappedListingsFallBackToTheDefaultLimit() throws Exception {
			StringBuilder cells = new StringBuilder();
			for (int i = 0; i < 5; i++) {
				cells.append("<mxCell id=\"n").append(i).append("\" value=\"N").append(i)
						.append("\" vertex=\"1\" parent=\"1\"/>");
			}
			String file = DiagramFixtures.write(tempDir, "many.drawio", DiagramFixtures.model(cells.toString()))
					.toString();
			DiagramQueryService small = new DiagramQueryService(new DiagramLoader(), 3, 64);

			GroupedListing<ComponentInfo> components = small.components(file, QueryOptions.all());
			GroupedListing<TextItem> texts = small.textInventory(file, QueryOptions.all());

			assertEquals(3, components.getReturned());
			assertTrue(components.isTruncated());
			assertEquals(5, texts.getReturned());
			assertNull(texts.getLimit());
		}

		@Test
		void emptyPageIsAnEmptySuccess() throws Exception {
			String file = DiagramFixtures.write(tempDir, "empty.drawio",
					DiagramFixtures.mxfile("<diagram name=\"Blank\"></diagram>")).toString();

			GroupedListing<ComponentInfo> listing = service.components(file, QueryOptions.page("Blank"));

			assertEquals(0, listing.getTotal());
			assertEquals(1, listing.getPages().size());
		}
	}

	@Nested
	@DisplayName("Render")
	class Render {

		@Test
		void untitledContainersAreTransparent() {
			HierarchyRender render = service.render(twoPageFile, QueryOptions.page("Architecture"));
			PageRender page = render.pages().get(0);

			assertEquals(List.of("api", "db"),
					page.tree().stream().map(n -> n.id()).collect(Collectors.toList()));
			assertTrue(page.orphans().isEmpty());
			assertEquals(List.of(
					"[rounded-rect] API Gateway",
					"[database] Orders DB",
					"Connections:",
					"  API Gateway -> Orders DB [reads] (flow)"), page.outline());
		}

		@Test
		void childrenAndOutgoingEdgesNestUnderTheirContainer() throws Exception {
			String file = DiagramFixtures.write(tempDir, "nested.drawio", DiagramFixtures.model(
					"<mxCell id=\"svc\" value=\"Service\" style=\"swimlane;\" vertex=\"1\" parent=\"1\"/>"
							+ "<mxCell id=\"h\" value=\"Handler\" vertex=\"1\" parent=\"svc\"/>"
							+ "<mxCell id=\"r\" value=\"Repo\" vertex=\"1\" parent=\"svc\"/>"
							+ "<mxCell id=\"e\" value=\"calls\" style=\"dashed=1;\" edge=\"1\" parent=\"svc\" source=\"h\" target=\"r\"/>"))
					.toString();

			PageRender page = service.render(file, QueryOptions.all()).pages().get(0);

			assertEquals(List.of(
					"[swimlane] Service",
					"  [shape] Handler",
					"  [shape] Repo",
					"  -> Repo [calls] (dependency)",
					"Connections:",
					"  Handler -> Repo [calls] (dependency)"), page.outline());
		}

		@Test
		void loneLabelInsideUntitledContainerIsAnOrphan() throws Exception {
			String file = DiagramFixtures.write(tempDir, "orphan.drawio", DiagramFixtures.model(
					"<mxCell id=\"box\" value=\"\" vertex=\"1\" parent=\"1\"/>"
							+ "<mxCell id=\"o\" value=\"Lonely\" vertex=\"1\" parent=\"box\"/>"
							+ "<mxCell id=\"t\" value=\"Top\" vertex=\"1\" parent=\"1\"/>")).toString();

			PageRender page = service.render(file, QueryOptions.all()).pages().get(0);

			assertEquals(List.of("t"), page.tree().stream().map(n -> n.id()).collect(Collectors.toList()));
			assertEquals(1, page.orphans().size());
			assertEquals("box", page.orphans().get(0).parentId());
			assertEquals(List.of("[shape] Top", "Orphans:", "  [shape] Lonely"), page.outline());
		}

		@Test
		void orphanKeepsItsOwnSubtree() throws Exception {
			String file = DiagramFixtures.write(tempDir, "orphan-class.drawio", DiagramFixtures.model(
					"<mxCell id=\"g\" value=\"\" style=\"group\" vertex=\"1\" parent=\"1\"/>"
							+ "<mxCell id=\"cls\" value=\"Customer\" style=\"swimlane;\" vertex=\"1\" parent=\"g\"/>"
							+ "<mxCell id=\"f1\" value=\"+ id: int\" style=\"text;\" vertex=\"1\" parent=\"cls\"/>"
							+ "<mxCell id=\"f2\" value=\"+ name: String\" style=\"text;\" vertex=\"1\" parent=\"cls\"/>"))
					.toString();

			PageRender page = service.render(file, QueryOptions.all()).pages().get(0);

			assertTrue(page.tree().isEmpty());
			assertEquals(1, page.orphans().size());
			assertEquals("cls", page.orphans().get(0).id());
			assertEquals(List.of("f1", "f2"),
					page.orphans().get(0).children().stream().map(n -> n.id()).collect(Collectors.toList()));
			assertEquals(List.of(
					"Orphans:",
					"  [swimlane] Customer",
					"    [text] + id: int",
					"    [text] + name: String"), page.outline());
		}

		@Test
		void descentStopsAtTheDepthCap() throws Exception {
			String file = DiagramFixtures.write(tempDir, "deep.drawio", DiagramFixtures.model(
					"<mxCell id=\"n1\" value=\"One\" vertex=\"1\" parent=\"1\"/>"
							+ "<mxCell id=\"n2\" value=\"Two\" vertex=\"1\" parent=\"n1\"/>"
							+ "<mxCell id=\"n3\" value=\"Three\" vertex=\"1\" parent=\"n2\"/>"
							+ "<mxCell id=\"n4\" value=\"Four\" vertex=\"1\" parent=\"n3\"/>")).toString();
			DiagramQueryService shallow = new DiagramQueryService(new DiagramLoader(), 100, 2);

			PageRender page = shallow.render(file, QueryOptions.all()).pages().get(0);

			RenderedNode third = page.tree().get(0).children().get(0).children().get(0);
			assertEquals("n3", third.id());
			assertTrue(third.children().isEmpty());
			assertEquals(List.of("[shape] One", "  [shape] Two", "    [shape] Three"), page.outline());
		}

		@Test
		void parentCycleRendersWithoutLooping() throws Exception {
			String file = DiagramFixtures.write(tempDir, "cycle.drawio", DiagramFixtures.model(
					"<mxCell id=\"a\" value=\"A\" vertex=\"1\" parent=\"b\"/>"
							+ "<mxCell id=\"b\" value=\"B\" vertex=\"1\" parent=\"a\"/>"
							+ "<mxCell id=\"s\" value=\"Self\" vertex=\"1\" parent=\"s\"/>")).toString();

			PageRender page = service.render(file, QueryOptions.all()).pages().get(0);

			assertEquals(5, page.cells());
			assertTrue(page.tree().isEmpty());
		}

		@Test
		void compressedAndInlineStorageRenderTheSame() throws Exception {
			String inline = DiagramFixtures.write(tempDir, "inline.drawio",
					DiagramFixtures.mxfile(DiagramFixtures.inlinePage("P", CLASSES_CELLS))).toString();
			String packed = DiagramFixtures.write(tempDir, "packed.drawio",
					DiagramFixtures.mxfile(DiagramFixtures.compressedPage("P", CLASSES_CELLS))).toString();

			PageRender a = service.render(inline, QueryOptions.all()).pages().get(0);
			PageRender b = service.render(packed, QueryOptions.all()).pages().get(0);

			assertEquals(a.outline(), b.outline());
			assertEquals(a.tree(), b.tree());
		}
	}

	@Nested
	@DisplayName("Errors and dispatch")
	class Dispatch {

		@Test
		void unknownPageSuggestsSimilarNames() {
			DrawioMcpException e = assertThrows(DrawioMcpException.class,
					() -> service.components(twoPageFile, QueryOptions.page("Architectur")));

			assertEquals(DrawioMcpError.ErrorCode.PAGE_NOT_FOUND.getCode(), e.getErrorCode());
			assertEquals(List.of("Architecture", "Classes"), e.getErr().getRelatedResources());
			assertTrue(e.getErr().getSuggestions().stream()
					.anyMatch(s -> s.getExamples() != null && s.getExamples().contains("Architecture")));
		}

		@Test
		void unknownOperationIsRejectedBeforeReadingTheFile() {
			DrawioMcpException e = assertThrows(DrawioMcpException.class,
					() -> service.execute("summarize", tempDir.resolve("missing.drawio").toString(),
							QueryOptions.all()));

			assertEquals(DrawioMcpError.ErrorCode.UNKNOWN_OPERATION.getCode(), e.getErrorCode());
		}

		@Test
		void operationsAnswerToOperationAndToolNames() {
			Object byOperation = service.execute("relationships", twoPageFile, QueryOptions.all());
			Object byTool = service.execute("EXTRACT_RELATIONSHIPS", twoPageFile, QueryOptions.all());

			assertTrue(byOperation instanceof GroupedListing);
			assertEquals(toJson(byOperation), toJson(byTool));
		}

		@Test
		void repeatedQueriesReturnIdenticalResults() {
			for (DiagramOperation operation : DiagramOperation.values()) {
				assertEquals(toJson(service.execute(operation, twoPageFile, QueryOptions.all())),
						toJson(service.execute(operation, twoPageFile, QueryOptions.all())), operation.name());
			}
		}

		private String toJson(Object value) {
			try {
				return JsonMapperHolder.toJson(value);
			} catch (Exception e) {
				throw new AssertionError(e);
			}
		}
	}
}
