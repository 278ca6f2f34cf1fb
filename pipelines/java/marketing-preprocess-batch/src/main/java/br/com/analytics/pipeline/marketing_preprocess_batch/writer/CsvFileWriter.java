package br.com.analytics.pipeline.marketing_preprocess_batch.writer;

import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.file.FlatFileItemWriter;
import org.springframework.batch.infrastructure.item.file.builder.FlatFileItemWriterBuilder;
import org.springframework.batch.infrastructure.item.file.transform.FieldExtractor;
import org.springframework.core.io.FileSystemResource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public abstract class CsvFileWriter<T> {

    private static final String LINE_SEPARATOR = "\n";

    protected abstract List<String> header();

    protected abstract FieldExtractor<T> fieldExtractor();

    public int write(List<T> items, Path destination) throws Exception {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        FlatFileItemWriter<T> delegateWriter = createDelegateWriter(destination);
        delegateWriter.open(new ExecutionContext());
        try {
            delegateWriter.write(new Chunk<>(items));
        } finally {
            delegateWriter.close();
        }
        return items.size();
    }

    private FlatFileItemWriter<T> createDelegateWriter(Path destination) {
        String headerLine = String.join(",", header());
        return new FlatFileItemWriterBuilder<T>()
                .name(getClass().getSimpleName())
                .resource(new FileSystemResource(destination))
                .saveState(false)
                .transactional(false)
                .shouldDeleteIfExists(true)
                .lineSeparator(LINE_SEPARATOR)
                .headerCallback(writer -> writer.write(headerLine))
                .lineAggregator(new CsvLineAggregator<>(fieldExtractor()))
                .build();
    }
}
