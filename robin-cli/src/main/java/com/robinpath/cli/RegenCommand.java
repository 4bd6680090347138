package com.robinpath.cli;

import com.google.gson.JsonParseException;
import com.robinpath.compiler.ast.stmt.Statement;
import com.robinpath.compiler.formatter.PrintDiagnostic;
import com.robinpath.compiler.regen.RegenerationResult;
import com.robinpath.compiler.regen.SourceRegenerator;
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
 * picocli regen 子命令：用（可能被修改过的）JSON 语法树再生成源码，结果输出到标准输出
 */
@Command(name = "regen", description = "根据 JSON 语法树再生成源码")
public class RegenCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "原始源码文件路径")
    Path file;

    @Option(names = "--tree", required = true, description = "JSON 语法树文件（由 ast 子命令生成）")
    Path tree;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        for (Path path : new Path[]{file, tree}) {
            if (!Files.exists(path)) {
                err.println("错误: 文件不存在 - " + path);
                return 2;
            }
        }

        List<Statement> mutated;
        try {
            mutated = new AstJsonSerializer().fromJson(SourceFiles.read(tree));
        } catch (JsonParseException | IllegalStateException | ClassCastException e) {
            err.println("语法树格式错误: " + e.getMessage());
            return 2;
        }

        RegenerationResult result = new SourceRegenerator().regenerate(SourceFiles.read(file), mutated);
        for (PrintDiagnostic diagnostic : result.getDiagnostics()) {
            err.println("警告: " + diagnostic);
        }
        out.print(result.getSource());
        out.flush();
        return 0;
    }
}
