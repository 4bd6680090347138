package com.robinpath.cli;

import com.robinpath.compiler.ast.stmt.Statement;
import com.robinpath.compiler.serialization.AstJsonSerializer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli ast 子命令：输出 JSON 语法树
 */
@Command(name = "ast", description = "以 JSON 输出语法树")
public class AstCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源码文件路径")
    Path file;

    @Option(names = "--pretty", description = "缩进输出")
    boolean pretty;

    @Override
    public Integer call() throws IOException {
        PrintWriter err = spec.commandLine().getErr();
        if (!Files.exists(file)) {
            err.println("错误: 文件不存在 - " + file);
            return 2;
        }
        List<Statement> program = SourceFiles.parse(SourceFiles.read(file), file, err);
        if (program == null) {
            return 2;
        }
        spec.commandLine().getOut().println(new AstJsonSerializer().toJsonString(program, pretty));
        return 0;
    }
}
