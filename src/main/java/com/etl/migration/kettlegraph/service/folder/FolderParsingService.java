package com.etl.migration.kettlegraph.service.folder;

import com.etl.migration.kettlegraph.config.ParsingExecutorConfig;
import com.etl.migration.kettlegraph.dto.ParseFailure;
import com.etl.migration.kettlegraph.dto.ParseResult;
import com.etl.migration.kettlegraph.dto.SourceFile;
import com.etl.migration.kettlegraph.dto.graph.FileDependency;
import com.etl.migration.kettlegraph.dto.graph.FolderFile;
import com.etl.migration.kettlegraph.dto.graph.FolderGraph;
import com.etl.migration.kettlegraph.exception.ParseErrorType;
import com.etl.migration.kettlegraph.service.AnalyzerConfigurationService;
import com.etl.migration.kettlegraph.service.graph.GraphAssembler;
import com.etl.migration.kettlegraph.service.parser.KettleDocumentReader;
import com.etl.migration.kettlegraph.service.parser.WorkflowParserService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Parses every workflow file of a folder (or upload batch) and builds the folder graph.
 *
 * Files are parsed independently on the parsing executor. A file that fails is reported in the
 * graph's failures and never aborts the batch; the final file order does not depend on which
 * worker finished first.
 */
@Service
@Slf4j
public class FolderParsingService {

    private final WorkflowParserService parserService;
    private final FolderDependencyResolver dependencyResolver;
    private final GraphAssembler graphAssembler;
    private final AnalyzerConfigurationService configService;
    private final ExecutorService parsingExecutor;

    public FolderParsingService(WorkflowParserService parserService,
                                FolderDependencyResolver dependencyResolver,
                                GraphAssembler graphAssembler,
                                AnalyzerConfigurationService configService,
                                @Qualifier(ParsingExecutorConfig.PARSING_EXECUTOR) ExecutorService parsingExecutor) {
        this.parserService = parserService;
        this.dependencyResolver = dependencyResolver;
        this.graphAssembler = graphAssembler;
        this.configService = configService;
        this.parsingExecutor = parsingExecutor;
    }

    public FolderGraph parseFolder(String folderName, List<SourceFile> sources) {
        return parseFolder(folderName, sources, FileOrdering.BY_FILE_NAME);
    }

    public FolderGraph parseFolder(String folderName, List<SourceFile> sources, FileOrdering ordering) {
        List<SourceFile> workflowFiles = order(selectWorkflowFiles(sources), ordering);
        log.info("Parsing folder {}: {} workflow file(s) out of {}", folderName, workflowFiles.size(), sources.size());

        List<Future<ParseResult>> futures = new ArrayList<>(workflowFiles.size());
        for (SourceFile source : workflowFiles) {
            futures.add(parsingExecutor.submit(() -> parserService.parse(source.getFileName(), source.getContent())));
        }

        List<FolderFile> files = new ArrayList<>();
        List<ParseFailure> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            SourceFile source = workflowFiles.get(i);
            ParseResult result = await(futures, i, source.getFileName());
            if (result.isSuccess()) {
                files.add(FolderFile.builder()
                        .fileName(source.getFileName())
                        .kind(result.getDocument().getKind())
                        .size(source.getContent() == null ? 0 : source.getContent().length)
                        .document(result.getDocument())
                        .build());
            } else {
                failures.add(result.toFailure());
            }
        }

        List<FileDependency> dependencies = dependencyResolver.resolve(files);
        return graphAssembler.assemble(folderName, files, dependencies, failures);
    }

    private ParseResult await(List<Future<ParseResult>> futures, int index, String fileName) {
        try {
            return futures.get(index).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.subList(index, futures.size()).forEach(future -> future.cancel(true));
            throw new IllegalStateException("Interrupted while parsing " + fileName, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Unexpected error while parsing {}", fileName, cause);
            return ParseResult.builder()
                    .success(false)
                    .fileName(fileName)
                    .errorType(ParseErrorType.MALFORMED)
                    .error("Unexpected error: " + cause.getMessage())
                    .build();
        }
    }

    private List<SourceFile> selectWorkflowFiles(List<SourceFile> sources) {
        List<String> extensions = configService.getWorkflowFileExtensions().stream()
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        return sources.stream()
                .filter(source -> extensions.contains(KettleDocumentReader.extensionOf(source.getFileName())))
                .collect(Collectors.toList());
    }

    private List<SourceFile> order(List<SourceFile> sources, FileOrdering ordering) {
        if (ordering == FileOrdering.AS_SUPPLIED) {
            return sources;
        }
        return sources.stream()
                .sorted(Comparator.comparing(SourceFile::getFileName))
                .collect(Collectors.toList());
    }
}
