package dev.openresearch.mcp.format;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class MarkdownRendererTest {

	private final MarkdownRenderer renderer = new MarkdownRenderer();

	@Test
	void paperSearchListsPapersWithAuthorsAndIds() {
		Map<String, Object> result = Map.of("count", 1, "papers",
				List.of(Map.of("id", "p-1", "title", "Graph Attention Networks", "published_at",
						"2018-02-15T00:00:00Z", "citations", 120, "authors",
						List.of(Map.of("name", "Petar"), Map.of("name", "Guillem"), Map.of("name", "Arantxa"),
								Map.of("name", "Adriana")))));

		String markdown = renderer.paperSearch(result, "graph attention");

		assertThat(markdown).contains("**Query**: graph attention")
			.contains("### 1. Graph Attention Networks")
			.contains("**Authors**: Petar, Guillem, Arantxa et al. (4 authors)")
			.contains("**Published At**: 2018-02-15")
			.contains("**Citations**: 120")
			.contains("**ID**: p-1");
	}

	@Test
	void emptySearchSaysNothingWasFound() {
		assertThat(renderer.paperSearch(Map.of("papers", List.of(), "count", 0), "quantum"))
			.isEqualTo("No papers found for \"quantum\".\n");
	}

	@Test
	void missingFieldsFallBackToPlaceholders() {
		String markdown = renderer.paperSearch(Map.of("papers", List.of(Map.of())), "q");

		assertThat(markdown).contains("Unknown Title").contains("Unknown Author").contains("**ID**: N/A");
	}

	@Test
	void topKeywordsDrawsBarsRelativeToTheMostFrequent() {
		Map<String, Object> result = Map.of("count", 2, "keywords",
				List.of(Map.of("keyword", "llm", "paper_count", 10), Map.of("keyword", "rag", "paper_count", 5)));

		String markdown = renderer.topKeywords(result);

		assertThat(markdown).contains("1. **llm** `" + "█".repeat(20) + "` 10 papers")
			.contains("2. **rag** `" + "█".repeat(10) + "░".repeat(10) + "` 5 papers");
	}

	@Test
	void citationsShowBothDirections() {
		Map<String, Object> result = Map.of("citing_papers", List.of(Map.of("id", "c1", "title", "Follow-up")),
				"cited_papers", List.of(), "incoming_citations_count", 1, "outgoing_citations_count", 0,
				"total_citations_count", 1);

		String markdown = renderer.paperCitations(result, "p-9");

		assertThat(markdown).contains("# Citations of `p-9`")
			.contains("## Citing papers (1)")
			.contains("1. Follow-up (`c1`)")
			.contains("## Cited papers (0)");
	}

	@Test
	void domainTrendsRenderAsTable() {
		Map<String, Object> result = Map.of("data_points",
				List.of(Map.of("period", "2023", "publication_count", 10),
						Map.of("period", "2024", "publication_count", 14)));

		String markdown = renderer.domainTrends(result, "nlp");

		assertThat(markdown).contains("# Research trends: nlp").contains("| 2024 |");
	}

	@Test
	void collaborationNetworkNamesTheStrongestPairs() {
		Map<String, Object> result = Map.of(
				"nodes",
				List.of(Map.of("id", "a1", "type", "author", "properties", Map.of("name", "Ada")),
						Map.of("id", "a2", "type", "author", "properties", Map.of("name", "Alan"))),
				"edges", List.of(Map.of("source", "a1", "target", "a2", "type", "collaborates", "properties",
						Map.of("papers_count", 3))));

		String markdown = renderer.collaborationNetwork(result);

		assertThat(markdown).contains("**Nodes**: 2").contains("- author: 2").contains("- Ada & Alan: 3 joint papers");
	}

}
