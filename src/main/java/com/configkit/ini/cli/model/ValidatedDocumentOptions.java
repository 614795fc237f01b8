package com.configkit.ini.cli.model;

import java.nio.charset.Charset;

import com.configkit.ini.parser.IniParserOptions;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Resolved reading settings, ready for the parser. Keeps the commands thin.
 */
@Data
@AllArgsConstructor
public class ValidatedDocumentOptions {
    Charset charset;
    IniParserOptions parserOptions;
}
