package dev.openresearch.mcp.format;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

/**
 * Renders normalized backend payloads as Markdown for clients that asked for
 * {@link ResponseFormat#MARKDOWN}. Rendering never fails on missing fields; absent values fall back
 * to placeholders.
 */
@Component
public class MarkdownRenderer {

	private static final int MAX_LISTED_AUTHORS = 3;

	private static final int MAX_LISTED_KEYWORDS = 5;

	private static final int ABSTRACT_LENGTH = 200;

	private static final int BAR_WIDTH = 20;

	private static final int MAX_LISTED_NODES = 10;

	public String paperSearch(Map<String, Object> result, String query) {
		List<Map<String, Object>> papers = maps(result.get("papers"));
		if (papers.isEmpty()) {
			return emptyResult(query, "papers");
		}
		StringBuilder out = new StringBuilder();
		out.append("# Paper search results\n\n");
		out.append("**Query**: ").append(query).append('\n');
		out.append("**Results**: ").append(number(result, "count")).append("\n\n");
		int index = 1;
		for (Map<String, Object> paper : papers) {
			out.append("### ").append(index++).append(". ").append(text(paper, "title", "Unknown Title")).append("\n\n");
			paperBasics(out, paper);
			String abstractText = text(paper, "abstract", "");
			if (!abstractText.isEmpty()) {
				out.append("**Abstract**: ").append(truncate(abstractText, ABSTRACT_LENGTH)).append('\n');
			}
			keywords(out, paper);
			paperLink(out, paper);
			out.append("**ID**: ").append(text(paper, "id", "N/A")).append("\n\n---\n\n");
		}
		return out.toString();
	}

	/**
	 * Details of papers resolved from titles.
	 * @param papers best matches, in request order
	 * @param unmatched titles for which the backend returned nothing
	 * @return rendered details
	 */
	public String paperDetails(List<Map<String, Object>> papers, List<String> unmatched) {
		StringBuilder out = new StringBuilder("# Paper details\n\n");
		if (papers.isEmpty()) {
			out.append("No paper details found.\n");
		}
		for (Map<String, Object> paper : papers) {
			out.append("## ").append(text(paper, "title", "Unknown Title")).append("\n\n");
			out.append("**Paper ID**: `").append(text(paper, "id", "N/A")).append("`\n");
			paperBasics(out, paper);
			out.append("**References**: ").append(number(paper, "references_count")).append('\n');
			String abstractText = text(paper, "abstract", "");
			if (!abstractText.isEmpty()) {
				out.append("\n**Abstract**: ").append(abstractText).append('\n');
			}
			keywords(out, paper);
			paperLink(out, paper);
			out.append("\n---\n\n");
		}
		if (!unmatched.isEmpty()) {
			out.append("**Not found**: ").append(String.join("; ", unmatched)).append('\n');
		}
		return out.toString();
	}

	public String paperCitations(Map<String, Object> result, String paperId) {
		StringBuilder out = new StringBuilder("# Citations of `" + paperId + "`\n\n");
		out.append("**Cited by**: ").append(number(result, "incoming_citations_count")).append('\n');
		out.append("**References**: ").append(number(result, "outgoing_citations_count")).append('\n');
		out.append("**Total**: ").append(number(result, "total_citations_count")).append("\n\n");
		citationList(out, "Citing papers", maps(result.get("citing_papers")));
		citationList(out, "Cited papers", maps(result.get("cited_papers")));
		return out.toString();
	}

	public String authorSearch(Map<String, Object> result, String query) {
		List<Map<String, Object>> authors = maps(result.get("authors"));
		if (authors.isEmpty()) {
			return emptyResult(query, "authors");
		}
		StringBuilder out = new StringBuilder("# Author search results\n\n");
		out.append("**Query**: ").append(query).append('\n');
		out.append("**Results**: ").append(number(result, "count")).append("\n\n");
		int index = 1;
		for (Map<String, Object> author : authors) {
			out.append("### ").append(index++).append(". ").append(text(author, "name", "Unknown Author")).append("\n\n");
			authorBasics(out, author);
			out.append('\n');
		}
		return out.toString();
	}

	public String authorDetails(Map<String, Object> result) {
		List<Map<String, Object>> authors = maps(result.get("authors"));
		if (authors.isEmpty()) {
			return "No author details found.\n";
		}
		StringBuilder out = new StringBuilder("# Author details\n\n");
		for (Map<String, Object> author : authors) {
			out.append("## ").append(text(author, "name", "Unknown Author")).append("\n\n");
			out.append("**Author ID**: `").append(text(author, "id", "N/A")).append("`\n");
			authorBasics(out, author);
			List<Object> interests = list(author.get("research_interests"));
			if (!interests.isEmpty()) {
				out.append("**Research interests**: ").append(join(interests, MAX_LISTED_KEYWORDS)).append('\n');
			}
			out.append('\n');
		}
		return out.toString();
	}

	public String authorPapers(Map<String, Object> result, String authorId) {
		List<Map<String, Object>> papers = maps(result.get("papers"));
		StringBuilder out = new StringBuilder("# Papers by author `" + authorId + "`\n\n");
		out.append("**Papers**: ").append(number(result, "count")).append("\n\n");
		if (papers.isEmpty()) {
			return out.append("No papers found for this author.\n").toString();
		}
		int index = 1;
		for (Map<String, Object> paper : papers) {
			out.append(index++).append(". **").append(text(paper, "title", "Unknown Title")).append("**");
			String published = date(text(paper, "published_at", ""));
			out.append(" (").append(published).append(")");
			int citations = number(paper, "citations");
			if (citations > 0) {
				out.append(", ").append(citations).append(" citations");
			}
			out.append('\n');
		}
		return out.toString();
	}

	public String citationNetwork(Map<String, Object> result) {
		List<Map<String, Object>> nodes = maps(result.get("nodes"));
		List<Map<String, Object>> edges = maps(result.get("edges"));
		StringBuilder out = new StringBuilder("# Citation network\n\n");
		networkSummary(out, nodes, edges);
		List<Map<String, Object>> papers = nodes.stream()
			.filter(node -> "paper".equals(node.get("type")))
			.sorted((left, right) -> Integer.compare(number(properties(right), "citations"),
					number(properties(left), "citations")))
			.limit(MAX_LISTED_NODES)
			.collect(Collectors.toList());
		if (!papers.isEmpty()) {
			out.append("\n## Most cited papers\n\n");
			int index = 1;
			for (Map<String, Object> node : papers) {
				Map<String, Object> properties = properties(node);
				out.append(index++).append(". ")
					.append(text(properties, "title", text(node, "label", text(node, "id", "?"))))
					.append(" (")
					.append(number(properties, "citations"))
					.append(" citations)\n");
			}
		}
		return out.toString();
	}

	public String collaborationNetwork(Map<String, Object> result) {
		List<Map<String, Object>> nodes = maps(result.get("nodes"));
		List<Map<String, Object>> edges = maps(result.get("edges"));
		StringBuilder out = new StringBuilder("# Collaboration network\n\n");
		networkSummary(out, nodes, edges);
		List<Map<String, Object>> collaborations = edges.stream()
			.filter(edge -> "collaborates".equals(edge.get("type")))
			.sorted((left, right) -> Integer.compare(number(properties(right), "papers_count"),
					number(properties(left), "papers_count")))
			.limit(MAX_LISTED_NODES)
			.collect(Collectors.toList());
		if (!collaborations.isEmpty()) {
			out.append("\n## Strongest collaborations\n\n");
			for (Map<String, Object> edge : collaborations) {
				out.append("- ")
					.append(nodeLabel(nodes, text(edge, "source", "")))
					.append(" & ")
					.append(nodeLabel(nodes, text(edge, "target", "")))
					.append(": ")
					.append(number(properties(edge), "papers_count"))
					.append(" joint papers\n");
			}
		}
		return out.toString();
	}

	public String trendingPapers(Map<String, Object> result, String timeWindow) {
		List<Map<String, Object>> papers = maps(result.get("trending_papers"));
		StringBuilder out = new StringBuilder("# Trending papers (" + timeWindow + ")\n\n");
		out.append("**Papers**: ").append(number(result, "count")).append("\n\n");
		if (papers.isEmpty()) {
			return out.append("No trending papers for this period.\n").toString();
		}
		int index = 1;
		for (Map<String, Object> paper : papers) {
			out.append("### ").append(index++).append(". ").append(text(paper, "title", "Unknown Title")).append("\n\n");
			paperBasics(out, paper);
			Object score = paper.get("popularity_score");
			if (score instanceof Number popularity) {
				out.append("**Popularity score**: ").append(String.format(Locale.ROOT, "%.3f", popularity.doubleValue())).append('\n');
			}
			keywords(out, paper);
			out.append("**ID**: `").append(text(paper, "id", "N/A")).append("`\n\n---\n\n");
		}
		return out.toString();
	}

	public String topKeywords(Map<String, Object> result) {
		List<Map<String, Object>> keywords = maps(result.get("keywords"));
		StringBuilder out = new StringBuilder("# Top research keywords\n\n");
		out.append("**Keywords**: ").append(number(result, "count")).append("\n\n");
		if (keywords.isEmpty()) {
			return out.append("No keyword data available.\n").toString();
		}
		int max = keywords.stream().mapToInt(keyword -> number(keyword, "paper_count")).max().orElse(0);
		int index = 1;
		for (Map<String, Object> keyword : keywords) {
			int papers = number(keyword, "paper_count");
			int filled = max > 0 ? papers * BAR_WIDTH / max : 0;
			out.append(index++)
				.append(". **")
				.append(text(keyword, "keyword", "Unknown"))
				.append("** `")
				.append("█".repeat(filled))
				.append("░".repeat(BAR_WIDTH - filled))
				.append("` ")
				.append(papers)
				.append(" papers\n");
		}
		return out.toString();
	}

	public String domainTrends(Map<String, Object> result, String domain) {
		List<Map<String, Object>> points = maps(result.get("data_points"));
		StringBuilder out = new StringBuilder("# Research trends: " + domain + "\n\n");
		if (points.isEmpty()) {
			return out.append("No trend data available.\n").toString();
		}
		List<String> columns = new ArrayList<>();
		points.forEach(point -> point.keySet().forEach(key -> {
			if (!columns.contains(key)) {
				columns.add(key);
			}
		}));
		out.append("| ").append(String.join(" | ", columns)).append(" |\n");
		out.append("|").append(" --- |".repeat(columns.size())).append('\n');
		for (Map<String, Object> point : points) {
			out.append("| ")
				.append(columns.stream().map(column -> scalar(point.get(column))).collect(Collectors.joining(" | ")))
				.append(" |\n");
		}
		return out.toString();
	}

	public String landscape(Map<String, Object> result, String domain) {
		StringBuilder out = new StringBuilder("# Research landscape: " + domain + "\n\n");
		result.forEach((key, value) -> {
			if ("domain".equals(key)) {
				return;
			}
			out.append("## ").append(heading(key)).append("\n\n");
			if (value instanceof Collection<?> items) {
				if (items.isEmpty()) {
					out.append("_none_\n");
				}
				items.forEach(item -> out.append("- ").append(scalar(item)).append('\n'));
			}
			else if (value instanceof Map<?, ?> entries) {
				entries.forEach((name, item) -> out.append("- **").append(name).append("**: ").append(scalar(item)).append('\n'));
			}
			else {
				out.append(scalar(value)).append('\n');
			}
			out.append('\n');
		});
		return out.toString();
	}

	private void paperBasics(StringBuilder out, Map<String, Object> paper) {
		out.append("**Authors**: ").append(authors(list(paper.get("authors")))).append('\n');
		out.append("**Published At**: ").append(date(text(paper, "published_at", ""))).append('\n');
		int citations = number(paper, "citations");
		if (citations > 0) {
			out.append("**Citations**: ").append(citations).append('\n');
		}
		String venue = text(paper, "venue_name", "");
		if (!venue.isEmpty()) {
			out.append("**Published In**: ").append(venue).append('\n');
		}
	}

	private void authorBasics(StringBuilder out, Map<String, Object> author) {
		String affiliation = text(author, "affiliation", "");
		if (!affiliation.isEmpty()) {
			out.append("**Affiliation**: ").append(affiliation).append('\n');
		}
		out.append("**Papers**: ").append(number(author, "paper_count")).append('\n');
		out.append("**Citations**: ").append(number(author, "citation_count")).append('\n');
		Object hIndex = author.get("h_index");
		if (hIndex != null) {
			out.append("**h-index**: ").append(hIndex).append('\n');
		}
	}

	private void keywords(StringBuilder out, Map<String, Object> paper) {
		List<Object> keywords = list(paper.get("keywords"));
		keywords.removeIf(keyword -> keyword == null || String.valueOf(keyword).isBlank());
		if (!keywords.isEmpty()) {
			out.append("**Keywords**: ").append(join(keywords, MAX_LISTED_KEYWORDS)).append('\n');
		}
	}

	private void paperLink(StringBuilder out, Map<String, Object> paper) {
		String url = text(paper, "url", "");
		String doi = text(paper, "doi", "");
		if (!url.isEmpty()) {
			out.append("**Link**: ").append(url).append('\n');
		}
		else if (!doi.isEmpty()) {
			out.append("**DOI**: ").append(doi).append('\n');
		}
	}

	private void citationList(StringBuilder out, String title, List<Map<String, Object>> papers) {
		out.append("## ").append(title).append(" (").append(papers.size()).append(")\n\n");
		if (papers.isEmpty()) {
			out.append("_none_\n\n");
			return;
		}
		int index = 1;
		for (Map<String, Object> paper : papers) {
			out.append(index++).append(". ").append(text(paper, "title", "Unknown Title"));
			String id = text(paper, "id", "");
			if (!id.isEmpty()) {
				out.append(" (`").append(id).append("`)");
			}
			out.append('\n');
		}
		out.append('\n');
	}

	private void networkSummary(StringBuilder out, List<Map<String, Object>> nodes, List<Map<String, Object>> edges) {
		out.append("**Nodes**: ").append(nodes.size()).append('\n');
		out.append("**Edges**: ").append(edges.size()).append('\n');
		Map<String, Long> nodeTypes = nodes.stream()
			.collect(Collectors.groupingBy(node -> text(node, "type", "unknown"), LinkedHashMap::new,
					Collectors.counting()));
		nodeTypes.forEach((type, count) -> out.append("- ").append(type).append(": ").append(count).append('\n'));
	}

	private String nodeLabel(List<Map<String, Object>> nodes, String id) {
		return nodes.stream()
			.filter(node -> id.equals(text(node, "id", "")))
			.findFirst()
			.map(node -> text(properties(node), "name", text(node, "label", id)))
			.orElse(id);
	}

	private String emptyResult(String query, String kind) {
		return "No " + kind + " found for \"" + query + "\".\n";
	}

	private static String authors(List<Object> authors) {
		if (authors.isEmpty()) {
			return "Unknown Author";
		}
		List<String> names = authors.stream()
			.limit(MAX_LISTED_AUTHORS)
			.map(author -> author instanceof Map<?, ?> map && map.get("name") != null
					? String.valueOf(map.get("name")) : String.valueOf(author))
			.collect(Collectors.toList());
		String joined = String.join(", ", names);
		return authors.size() > MAX_LISTED_AUTHORS ? joined + " et al. (" + authors.size() + " authors)" : joined;
	}

	private static String join(List<Object> values, int max) {
		String joined = values.stream().limit(max).map(String::valueOf).collect(Collectors.joining(", "));
		return values.size() > max ? joined + " ..." : joined;
	}

	private static String date(String value) {
		if (value.isEmpty()) {
			return "Unknown";
		}
		return value.length() > 10 ? value.substring(0, 10) : value;
	}

	private static String truncate(String value, int max) {
		String trimmed = value.strip();
		return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
	}

	private static String heading(String key) {
		String spaced = key.replace('_', ' ');
		return spaced.isEmpty() ? spaced : Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
	}

	private static String scalar(Object value) {
		if (value == null) {
			return "";
		}
		if (value instanceof Map<?, ?> map) {
			Object label = map.containsKey("name") ? map.get("name") : map.get("title");
			if (label != null) {
				return String.valueOf(label);
			}
			return map.entrySet()
				.stream()
				.map(entry -> entry.getKey() + "=" + entry.getValue())
				.collect(Collectors.joining(", "));
		}
		return String.valueOf(value);
	}

	private static Map<String, Object> properties(Map<String, Object> node) {
		return map(node.get("properties"));
	}

	static String text(Map<String, Object> source, String key, String fallback) {
		Object value = source.get(key);
		if (value == null) {
			return fallback;
		}
		String text = String.valueOf(value);
		return text.isBlank() ? fallback : text;
	}

	static int number(Map<String, Object> source, String key) {
		Object value = source.get(key);
		if (value instanceof Number number) {
			return number.intValue();
		}
		if (value instanceof String text) {
			try {
				return Integer.parseInt(text.trim());
			}
			catch (NumberFormatException ex) {
				return 0;
			}
		}
		return 0;
	}

	static List<Object> list(Object value) {
		return value instanceof Collection<?> items ? new ArrayList<>(items) : new ArrayList<>();
	}

	@SuppressWarnings("unchecked")
	static Map<String, Object> map(Object value) {
		return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
	}

	static List<Map<String, Object>> maps(Object value) {
		List<Map<String, Object>> maps = new ArrayList<>();
		for (Object item : list(value)) {
			if (item instanceof Map<?, ?>) {
				maps.add(map(item));
			}
		}
		return maps;
	}

}
