package com.configkit.ini.io;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.configkit.ini.model.Document;
import com.configkit.ini.model.Section;
import com.configkit.ini.parser.IniParser;
import com.configkit.ini.parser.IniParserOptions;

import lombok.experimental.UtilityClass;

/**
 * Loading and saving INI documents from files and streams. Streams passed in are never closed.
 * Async variants run the synchronous work on the given executor (the common pool by default)
 * and complete exceptionally with the original failure as cause.
 */
@UtilityClass
public class IniFiles {
    private static final Logger log = LoggerFactory.getLogger(IniFiles.class);

    public Document load(Path file) throws IOException {
        return load(file, StandardCharsets.UTF_8, IniParserOptions.defaults());
    }

    public Document load(Path file, Charset charset, IniParserOptions options) throws IOException {
        log.debug("Loading {} ({})", file, charset);
        try (BufferedReader reader = Files.newBufferedReader(file, charset)) {
            return new IniParser(options).parse(reader);
        }
    }

    public Document load(InputStream in, Charset charset, IniParserOptions options) throws IOException {
        return new IniParser(options).parse(new BufferedReader(new InputStreamReader(in, charset)));
    }

    /**
     * Loads {@code file} and drops every named section rejected by the options' section filter.
     */
    public Document load(Path file, LoadOptions options) throws IOException {
        Document document = load(file, options.getCharset(), options.getParserOptions());
        if (options.getSectionFilter() != null) {
            List<String> rejected = new ArrayList<>();
            for (Section section : document) {
                if (!options.getSectionFilter().test(section.getName())) {
                    rejected.add(section.getName());
                }
            }
            rejected.forEach(document::remove);
            log.debug("Section filter removed {} sections from {}", rejected.size(), file);
        }
        return document;
    }

    public void save(Document document, Path file) throws IOException {
        save(document, file, StandardCharsets.UTF_8);
    }

    public void save(Document document, Path file, Charset charset) throws IOException {
        log.debug("Saving {} ({})", file, charset);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, charset)) {
            new IniSerializer().write(document, writer);
        }
    }

    public void save(Document document, OutputStream out, Charset charset) throws IOException {
        Writer writer = new BufferedWriter(new OutputStreamWriter(out, charset));
        new IniSerializer().write(document, writer);
    }

    public CompletableFuture<Document> loadAsync(Path file, Charset charset, IniParserOptions options) {
        return loadAsync(file, charset, options, ForkJoinPool.commonPool());
    }

    public CompletableFuture<Document> loadAsync(Path file, Charset charset, IniParserOptions options,
            Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return load(file, charset, options);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    public CompletableFuture<Document> loadAsync(Path file, LoadOptions options) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return load(file, options);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, ForkJoinPool.commonPool());
    }

    public CompletableFuture<Void> saveAsync(Document document, Path file, Charset charset) {
        return saveAsync(document, file, charset, ForkJoinPool.commonPool());
    }

    public CompletableFuture<Void> saveAsync(Document document, Path file, Charset charset, Executor executor) {
        return CompletableFuture.runAsync(() -> {
            try {
                save(document, file, charset);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }
}
