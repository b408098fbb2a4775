package io.mnemos.cli;

import io.mnemos.core.cognitive.IngestResult;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "ingest", description = "Store a text file as a chunked, embedded document")
public final class IngestCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "File to ingest")
    Path file;

    @Option(names = "--title", description = "Document title (defaults to the file name)")
    String title;

    @Option(names = "--chunk-size", defaultValue = "500", description = "Characters per chunk")
    int chunkSize;

    @Option(names = "--overlap", defaultValue = "50", description = "Characters shared by adjacent chunks")
    int overlap;

    public IngestCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            String docTitle = title != null && !title.isBlank() ? title : file.getFileName().toString();
            IngestResult result = context.ingestor().store(
                docTitle,
                text,
                file.toAbsolutePath().toUri().toString(),
                "file",
                chunkSize,
                overlap
            );
            System.out.println("Stored document " + result.documentId() + " with " + result.chunkIds().size()
                + " chunks" + (result.embedded() ? "" : " (without embeddings)"));
            return 0;
        } catch (Exception e) {
            System.err.println("Ingest failed: " + e.getMessage());
            return 1;
        }
    }
}
