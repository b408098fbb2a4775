package io.mnemos.cli;

import io.mnemos.core.embedding.EmbeddingException;
import io.mnemos.core.graph.Node;
import io.mnemos.core.graph.NodeType;
import io.mnemos.core.graph.ScoredNode;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "search", description = "Search the graph by text, or by text and meaning within one node type")
public final class SearchCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Search text")
    String text;

    @Option(names = "--type", description = "Node label, enables hybrid text and vector search")
    String type;

    @Option(names = "--limit", defaultValue = "10", description = "Maximum results")
    int limit;

    public SearchCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (type == null || type.isBlank()) {
                List<Node> nodes = context.graph().store().searchAll(text, limit);
                nodes.forEach(node -> System.out.println(node.type().label() + "\t" + node.id() + "\t" + node.name()));
                if (nodes.isEmpty()) {
                    System.out.println("No matches");
                }
                return 0;
            }

            NodeType nodeType = NodeType.parse(type);
            double[] embedding = null;
            try {
                embedding = context.embeddings().embed(text);
            } catch (EmbeddingException e) {
                System.err.println("Embedding unavailable, text search only: " + e.getMessage());
            }
            List<ScoredNode> hits = context.graph().store().hybridSearch(text, embedding, nodeType, limit);
            for (ScoredNode hit : hits) {
                System.out.println(String.format(Locale.ROOT, "%.3f\t%s\t%s", hit.score(), hit.node().id(), hit.node().name()));
            }
            if (hits.isEmpty()) {
                System.out.println("No matches");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Search failed: " + e.getMessage());
            return 1;
        }
    }
}
