package com.robinpath.cli;

import com.robinpath.compiler.ast.stmt.Statement;
import com.robinpath.compiler.lexer.Lexer;
import com.robinpath.compiler.parser.ParseError;
import com.robinpath.compiler.parser.ParseResult;
import com.robinpath.compiler.parser.Parser;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * 子命令共用的文件读写和解析
 */
final class SourceFiles {

    private static final Logger LOG = Logger.getLogger(SourceFiles.class.getName());

    private SourceFiles() {}

    static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    static void write(Path path, String content) throws IOException {
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 容错解析。有语法错误时逐条输出到 err 并返回 null。
     */
    static List<Statement> parse(String source, Path path, PrintWriter err) {
        String fileName = path.getFileName().toString();
        ByteArrayOutputStream lexerErrors = new ByteArrayOutputStream();
        PrintStream lexerStream = new PrintStream(lexerErrors, true, StandardCharsets.UTF_8);
        ParseResult result = new Parser(new Lexer(source, fileName, lexerStream)).parseTolerant();
        String lexerOutput = new String(lexerErrors.toByteArray(), StandardCharsets.UTF_8);
        if (!lexerOutput.isEmpty()) {
            err.print(lexerOutput);
        }
        if (!result.hasErrors()) {
            return result.getStatements();
        }
        for (ParseError error : result.getErrors()) {
            String location = fileName + ":" + error.getLine() + ":" + error.getColumn();
            LOG.warning("Parse error at " + location + ": " + error.getMessage());
            err.println("语法错误: " + location + ": " + error.getMessage());
        }
        return null;
    }
}
