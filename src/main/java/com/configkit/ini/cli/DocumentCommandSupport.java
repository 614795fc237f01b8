package com.configkit.ini.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.configkit.ini.cli.exception.OptionsValidationException;
import com.configkit.ini.cli.model.DocumentOptions;
import com.configkit.ini.cli.model.ValidatedDocumentOptions;
import com.configkit.ini.cli.output.CommandResultsPrinter;
import com.configkit.ini.cli.validation.DocumentOptionsValidator;
import com.configkit.ini.io.IniFiles;
import com.configkit.ini.model.Document;
import com.configkit.ini.model.exception.DuplicateNameException;
import com.configkit.ini.parser.ParsingException;

import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Shared plumbing of the file commands: option validation, loading and error-to-exit-code mapping.
 * Exit codes: 0 success, 1 failure while processing, 2 invalid options.
 */
abstract class DocumentCommandSupport implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DocumentCommandSupport.class);

    @Mixin
    protected DocumentOptions documentOptions;

    @Spec
    protected CommandSpec spec;

    protected final CommandResultsPrinter printer = new CommandResultsPrinter();

    private ValidatedDocumentOptions validated;

    @Override
    public Integer call() {
        try {
            validated = new DocumentOptionsValidator().validate(documentOptions, collectParsingErrors(), inputs());
            return execute();
        } catch (OptionsValidationException e) {
            printer.printOptionErrors(e.getErrors());
            return 2;
        } catch (ParsingException e) {
            log.error("Cannot parse input: {}", e.getMessage());
            return 1;
        } catch (DuplicateNameException e) {
            log.error("Duplicate name in input: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("{} failed with exception", spec.name(), e);
            return 1;
        }
    }

    /**
     * Files that must exist before the command runs.
     */
    protected abstract List<Path> inputs();

    protected abstract int execute() throws IOException;

    protected boolean collectParsingErrors() {
        return false;
    }

    protected Document load(Path file) throws IOException {
        return IniFiles.load(file, validated.getCharset(), validated.getParserOptions());
    }

    protected void save(Document document, Path file) throws IOException {
        IniFiles.save(document, file, validated.getCharset());
    }
}
