package com.robinpath.cli;

import com.robinpath.compiler.ast.stmt.Statement;
import com.robinpath.compiler.formatter.FormatConfig;
import com.robinpath.compiler.formatter.StatementPrinter;
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
 * picocli fmt 子命令：按规范格式重写源码文件
 */
@Command(name = "fmt", description = "格式化源码文件")
public class FmtCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源码文件路径")
    Path file;

    @Option(names = "--check", description = "只检查，不写回；需要格式化时退出码为 1")
    boolean check;

    @Option(names = "--indent-size", defaultValue = "2", description = "缩进空格数（默认 2）")
    int indentSize;

    @Option(names = "--use-tabs", description = "使用 Tab 缩进")
    boolean useTabs;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (!Files.exists(file)) {
            err.println("错误: 文件不存在 - " + file);
            return 2;
        }

        String source = SourceFiles.read(file);
        List<Statement> program = SourceFiles.parse(source, file, err);
        if (program == null) {
            return 2;
        }

        FormatConfig config = new FormatConfig();
        config.setIndentSize(indentSize);
        config.setUseSpaces(!useTabs);
        String formatted = new StatementPrinter().print(program, config);

        if (check) {
            if (formatted.equals(source)) {
                return 0;
            }
            out.println("需要格式化: " + file);
            return 1;
        }
        if (!formatted.equals(source)) {
            SourceFiles.write(file, formatted);
        }
        out.println("已格式化: " + file);
        return 0;
    }
}
